package dev.regula.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.regula.corpus.Chunk;
import dev.regula.corpus.ChunkStore;
import dev.regula.corpus.EmbeddingProperties;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Nearest-neighbour search over the chunk embeddings loaded from the snapshot.
 *
 * <p>The query is embedded with the configured {@link EmbeddingModel}, prefixed with {@code
 * regula.embedding.query-prefix} (bge models expect an instruction prefix on queries but not on
 * documents). Embedding ids in the store are chunk ids; a hit whose id is unknown to the {@link
 * ChunkStore} means the two snapshot artifacts are out of sync.
 */
@Component
public class SemanticIndex {

  private final EmbeddingModel embeddingModel;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final ChunkStore chunkStore;
  private final String queryPrefix;

  public SemanticIndex(
      EmbeddingModel embeddingModel,
      EmbeddingStore<TextSegment> embeddingStore,
      ChunkStore chunkStore,
      EmbeddingProperties embeddingProperties) {
    this.embeddingModel = embeddingModel;
    this.embeddingStore = embeddingStore;
    this.chunkStore = chunkStore;
    this.queryPrefix = embeddingProperties.queryPrefix();
  }

  /**
   * Returns the chunks closest to the query.
   *
   * @param query the sanitized query
   * @param limit maximum number of hits
   * @return hits ordered by similarity descending
   * @throws RetrievalException if the embedding call fails or the snapshot is inconsistent
   */
  public List<IndexHit> search(String query, int limit) {
    Embedding queryEmbedding;
    try {
      queryEmbedding = embeddingModel.embed(queryPrefix + query).content();
    } catch (RuntimeException e) {
      throw new RetrievalException("Query embedding failed: " + e.getMessage(), e);
    }

    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(limit)
            .minScore(0.0)
            .build();

    List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
    List<IndexHit> hits = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      Chunk chunk =
          chunkStore
              .get(match.embeddingId())
              .orElseThrow(
                  () ->
                      new RetrievalException(
                          "Vector index references unknown chunk id " + match.embeddingId()));
      hits.add(new IndexHit(chunk, match.score()));
    }
    return hits;
  }
}
