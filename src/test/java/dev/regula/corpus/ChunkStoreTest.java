package dev.regula.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.regula.fixture.ChunkBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkStoreTest {

  @Test
  void looksUpChunksByIdAndKeepsSnapshotOrder() {
    Chunk first = new ChunkBuilder().id("b").page(2).build();
    Chunk second = new ChunkBuilder().id("a").page(1).build();

    ChunkStore store = new ChunkStore(List.of(first, second));

    assertThat(store.get("a")).contains(second);
    assertThat(store.get("missing")).isEmpty();
    assertThat(store.all()).containsExactly(first, second);
    assertThat(store.size()).isEqualTo(2);
    assertThat(store.isEmpty()).isFalse();
  }

  @Test
  void rejectsDuplicateIds() {
    Chunk one = new ChunkBuilder().id("dup").build();
    Chunk two = new ChunkBuilder().id("dup").page(3).build();

    assertThatThrownBy(() -> new ChunkStore(List.of(one, two)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("dup");
  }

  @Test
  void chunkDeduplicatesMediaAndDiagramsKeepingFirstSeenOrder() {
    Chunk chunk =
        new ChunkBuilder()
            .media("/media/page_4.png", "/media/page_3.png", "/media/page_4.png")
            .diagramIds("Diagram 2.1", "Diagram 1.4", "Diagram 2.1")
            .build();

    assertThat(chunk.media()).containsExactly("/media/page_4.png", "/media/page_3.png");
    assertThat(chunk.diagramIds()).containsExactly("Diagram 2.1", "Diagram 1.4");
  }

  @Test
  void chunkTreatsMissingListsAsEmpty() {
    Chunk chunk = new Chunk("c1", 1, "text", 1, null, null, false);

    assertThat(chunk.diagramIds()).isEmpty();
    assertThat(chunk.media()).isEmpty();
  }
}
