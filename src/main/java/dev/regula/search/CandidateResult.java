package dev.regula.search;

import dev.regula.corpus.Chunk;

/**
 * A chunk proposed by hybrid retrieval, before reranking.
 *
 * @param chunk the candidate chunk
 * @param score fused weighted reciprocal-rank score (higher is better)
 * @param semanticRank 1-based rank in the semantic hits, 0 if absent there
 * @param lexicalRank 1-based rank in the lexical hits, 0 if absent there
 */
public record CandidateResult(Chunk chunk, double score, int semanticRank, int lexicalRank) {}
