package dev.regula.rerank;

import dev.regula.corpus.Chunk;

/**
 * A candidate after reranking.
 *
 * @param chunk the candidate chunk
 * @param retrievalScore fused retrieval score
 * @param rerankScore model relevance score in [0, 1]
 */
public record RankedChunk(Chunk chunk, double retrievalScore, double rerankScore) {}
