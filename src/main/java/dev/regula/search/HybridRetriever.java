package dev.regula.search;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * First-stage retrieval: queries the semantic and lexical indexes one after the other and fuses
 * both rankings with {@link WeightedRankFusion}.
 */
@Service
public class HybridRetriever {

  private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

  private final SemanticIndex semanticIndex;
  private final LexicalIndex lexicalIndex;
  private final RetrievalProperties retrievalProperties;

  public HybridRetriever(
      SemanticIndex semanticIndex,
      LexicalIndex lexicalIndex,
      RetrievalProperties retrievalProperties) {
    this.semanticIndex = semanticIndex;
    this.lexicalIndex = lexicalIndex;
    this.retrievalProperties = retrievalProperties;
  }

  /**
   * Retrieves up to {@code candidateK} candidates for the query, best first.
   *
   * @param query the sanitized query
   * @param candidateK maximum number of candidates, also the per-index fetch size
   * @return fused candidates, never more than {@code candidateK}
   * @throws RetrievalException if the query is blank or neither index returns a hit
   */
  public List<CandidateResult> retrieve(@Nullable String query, int candidateK) {
    if (query == null || query.isBlank()) {
      throw new RetrievalException("Query is empty after sanitization");
    }
    if (candidateK < 1) {
      throw new IllegalArgumentException("candidateK must be >= 1, got: " + candidateK);
    }

    List<IndexHit> semanticHits = semanticIndex.search(query, candidateK);
    List<IndexHit> lexicalHits = lexicalIndex.search(query, candidateK);
    if (semanticHits.isEmpty() && lexicalHits.isEmpty()) {
      throw new RetrievalException("No candidates from either index");
    }

    List<CandidateResult> candidates =
        WeightedRankFusion.fuse(
            semanticHits,
            lexicalHits,
            retrievalProperties.getSemanticWeight(),
            retrievalProperties.getLexicalWeight(),
            retrievalProperties.getRankConstant(),
            candidateK);
    log.debug(
        "Retrieved {} candidates ({} semantic, {} lexical hits)",
        candidates.size(),
        semanticHits.size(),
        lexicalHits.size());
    return candidates;
  }
}
