package dev.regula.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.regula.corpus.ChunkStore;
import dev.regula.corpus.EmbeddingProperties;
import dev.regula.fixture.ChunkBuilder;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SemanticIndexTest {

  private static final String PREFIX = "query: ";

  private EmbeddingModel embeddingModel;
  private InMemoryEmbeddingStore<TextSegment> store;
  private SemanticIndex index;

  @BeforeEach
  void setUp() {
    embeddingModel = mock(EmbeddingModel.class);
    store = new InMemoryEmbeddingStore<>();
    store.add("doors", Embedding.from(new float[] {1f, 0f, 0f}), TextSegment.from("doors"));
    store.add("stairs", Embedding.from(new float[] {0f, 1f, 0f}), TextSegment.from("stairs"));
    store.add("mixed", Embedding.from(new float[] {0.7f, 0.7f, 0f}), TextSegment.from("mixed"));
    ChunkStore chunkStore =
        new ChunkStore(
            List.of(
                new ChunkBuilder().id("doors").build(),
                new ChunkBuilder().id("stairs").build(),
                new ChunkBuilder().id("mixed").build()));
    var properties = new EmbeddingProperties("bge-small", "unused", null, null, 1000, PREFIX, 64);
    index = new SemanticIndex(embeddingModel, store, chunkStore, properties);
  }

  @Test
  void returnsNearestChunksBestFirstWithQueryPrefix() {
    given(embeddingModel.embed(anyString()))
        .willReturn(Response.from(Embedding.from(new float[] {1f, 0.1f, 0f})));

    List<IndexHit> hits = index.search("fire doors", 2);

    assertThat(hits).extracting(h -> h.chunk().id()).containsExactly("doors", "mixed");
    assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    verify(embeddingModel).embed(PREFIX + "fire doors");
  }

  @Test
  void embeddingFailureIsRetrievalError() {
    given(embeddingModel.embed(anyString())).willThrow(new RuntimeException("model unavailable"));

    assertThatThrownBy(() -> index.search("fire doors", 5))
        .isInstanceOf(RetrievalException.class)
        .hasMessageContaining("model unavailable");
  }

  @Test
  void vectorWithoutChunkIsRetrievalError() {
    store.add("orphan", Embedding.from(new float[] {0f, 0f, 1f}), TextSegment.from("orphan"));
    given(embeddingModel.embed(anyString()))
        .willReturn(Response.from(Embedding.from(new float[] {0f, 0f, 1f})));

    assertThatThrownBy(() -> index.search("anything", 1))
        .isInstanceOf(RetrievalException.class)
        .hasMessageContaining("orphan");
  }
}
