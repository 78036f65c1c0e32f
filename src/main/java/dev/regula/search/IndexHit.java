package dev.regula.search;

import dev.regula.corpus.Chunk;

/**
 * A hit from a single index (semantic or lexical). Used as input to {@link WeightedRankFusion};
 * only the position of a hit in its list matters there, the raw score is kept for logging.
 *
 * @param chunk the matched chunk
 * @param score raw score from the source (cosine relevance for semantic, BM25 for lexical)
 */
public record IndexHit(Chunk chunk, double score) {}
