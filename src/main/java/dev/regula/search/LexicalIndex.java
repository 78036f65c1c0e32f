package dev.regula.search;

import dev.regula.corpus.Chunk;
import dev.regula.corpus.ChunkStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * BM25 keyword index over the chunk texts, built once from the {@link ChunkStore} at startup.
 *
 * <p>Postings are precomputed and never modified after construction, so searches need no locking.
 * Scoring uses the Lucene-style IDF {@code ln(1 + (N - n + 0.5) / (n + 0.5))}, which stays
 * positive for terms that occur in most documents.
 */
@Component
public class LexicalIndex {

  private static final Logger log = LoggerFactory.getLogger(LexicalIndex.class);

  static final double K1 = 1.2;
  static final double B = 0.75;

  private final List<Chunk> documents;
  private final int[] documentLengths;
  private final Map<String, List<Posting>> postings;
  private final double averageLength;

  public LexicalIndex(ChunkStore chunkStore) {
    this.documents = chunkStore.all();
    this.documentLengths = new int[documents.size()];
    this.postings = new HashMap<>();

    long totalLength = 0;
    for (int doc = 0; doc < documents.size(); doc++) {
      List<String> tokens = Tokenizer.tokenize(documents.get(doc).text());
      documentLengths[doc] = tokens.size();
      totalLength += tokens.size();

      Map<String, Integer> termFrequencies = new HashMap<>();
      for (String token : tokens) {
        termFrequencies.merge(token, 1, Integer::sum);
      }
      for (Map.Entry<String, Integer> entry : termFrequencies.entrySet()) {
        postings.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
            .add(new Posting(doc, entry.getValue()));
      }
    }
    this.averageLength =
        documents.isEmpty() ? 1.0 : Math.max(1.0, (double) totalLength / documents.size());
    log.info("Lexical index built: {} documents, {} terms", documents.size(), postings.size());
  }

  /**
   * Scores every chunk containing at least one query term.
   *
   * @param query the query text
   * @param limit maximum number of hits
   * @return hits with a positive score, best first; ties keep snapshot order
   */
  public List<IndexHit> search(String query, int limit) {
    if (limit < 1) {
      return List.of();
    }
    double[] scores = new double[documents.size()];
    boolean matched = false;
    int n = documents.size();

    for (String term : new LinkedHashSet<>(Tokenizer.tokenize(query))) {
      List<Posting> termPostings = postings.get(term);
      if (termPostings == null) {
        continue;
      }
      matched = true;
      double idf = Math.log(1.0 + (n - termPostings.size() + 0.5) / (termPostings.size() + 0.5));
      for (Posting posting : termPostings) {
        double lengthNorm = 1 - B + B * (documentLengths[posting.document()] / averageLength);
        double tf = posting.frequency();
        scores[posting.document()] += idf * (tf * (K1 + 1)) / (tf + K1 * lengthNorm);
      }
    }
    if (!matched) {
      return List.of();
    }

    List<Integer> ranked = new ArrayList<>();
    for (int doc = 0; doc < scores.length; doc++) {
      if (scores[doc] > 0) {
        ranked.add(doc);
      }
    }
    // List.sort is stable: equal scores keep snapshot order
    ranked.sort(Comparator.comparingDouble((Integer doc) -> scores[doc]).reversed());
    return ranked.stream()
        .limit(limit)
        .map(doc -> new IndexHit(documents.get(doc), scores[doc]))
        .toList();
  }

  private record Posting(int document, int frequency) {}
}
