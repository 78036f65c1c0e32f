package dev.regula.search;

import dev.regula.corpus.Chunk;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility for fusing semantic and lexical hits by weighted reciprocal rank.
 *
 * <p>Semantic similarity and BM25 scores are not on comparable scales, so only the rank positions
 * are combined: {@code score(c) = sum over sources of weight / (rankConstant + rank)}, with 1-based
 * ranks. A chunk present in both sources gets both contributions under a single entry.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class WeightedRankFusion {

  private WeightedRankFusion() {}

  /**
   * Fuses the two hit lists.
   *
   * <p>Ordering: fused score descending, then the better semantic rank (chunks absent from the
   * semantic hits last), then first-seen order (semantic hits before lexical-only hits).
   *
   * @param semanticHits hits from the semantic index, best first
   * @param lexicalHits hits from the lexical index, best first
   * @param semanticWeight weight of the semantic source
   * @param lexicalWeight weight of the lexical source
   * @param rankConstant reciprocal-rank damping constant (60 in the usual RRF formulation)
   * @param maxResults maximum number of results to return
   * @return fused candidates, one per chunk id, best first
   */
  public static List<CandidateResult> fuse(
      List<IndexHit> semanticHits,
      List<IndexHit> lexicalHits,
      double semanticWeight,
      double lexicalWeight,
      int rankConstant,
      int maxResults) {
    if (semanticHits.isEmpty() && lexicalHits.isEmpty()) {
      return List.of();
    }

    // Insertion order is the final tie-breaker
    Map<String, FusedEntry> fused = new LinkedHashMap<>();

    int rank = 0;
    for (IndexHit hit : semanticHits) {
      rank++;
      if (fused.containsKey(hit.chunk().id())) {
        continue;
      }
      fused.put(
          hit.chunk().id(),
          new FusedEntry(hit.chunk(), semanticWeight / (rankConstant + rank), rank, 0));
    }

    rank = 0;
    for (IndexHit hit : lexicalHits) {
      rank++;
      String id = hit.chunk().id();
      FusedEntry existing = fused.get(id);
      double contribution = lexicalWeight / (rankConstant + rank);
      if (existing == null) {
        fused.put(id, new FusedEntry(hit.chunk(), contribution, 0, rank));
      } else if (existing.lexicalRank() == 0) {
        fused.put(
            id,
            new FusedEntry(
                existing.chunk(),
                existing.score() + contribution,
                existing.semanticRank(),
                rank));
      }
    }

    return fused.values().stream()
        .sorted(
            Comparator.comparingDouble(FusedEntry::score)
                .reversed()
                .thenComparingInt(FusedEntry::semanticOrder))
        .limit(maxResults)
        .map(FusedEntry::toCandidate)
        .toList();
  }

  /** Internal holder for a fused result during combination. */
  private record FusedEntry(Chunk chunk, double score, int semanticRank, int lexicalRank) {

    int semanticOrder() {
      return semanticRank == 0 ? Integer.MAX_VALUE : semanticRank;
    }

    CandidateResult toCandidate() {
      return new CandidateResult(chunk, score, semanticRank, lexicalRank);
    }
  }
}
