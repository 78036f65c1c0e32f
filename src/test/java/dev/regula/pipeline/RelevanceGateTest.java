package dev.regula.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.regula.corpus.Chunk;
import dev.regula.fixture.ChunkBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class RelevanceGateTest {

  private final RelevanceGate gate = new RelevanceGate();

  @Test
  void sharedTermMakesContextRelevant() {
    assertThat(gate.isRelevant("What about FIRE doors?", "[Page 5]\nFire doors self-close."))
        .isTrue();
  }

  @Test
  void noSharedTermIsIrrelevant() {
    assertThat(gate.isRelevant("How do I bake banana bread?", "[Page 5]\nFire doors self-close."))
        .isFalse();
  }

  @Test
  void stopwordsAloneDoNotCount() {
    assertThat(gate.isRelevant("what is the", "The door is what it is.")).isFalse();
  }

  @Test
  void emptyContextIsIrrelevant() {
    assertThat(gate.isRelevant("fire doors", "")).isFalse();
  }

  @Test
  void pageMarkersDoNotCountAsOverlap() {
    Chunk doors = new ChunkBuilder().id("c5").page(5).text("Fire doors self-close.").build();

    assertThat(gate.isRelevant("banana recipe page 5", List.of(doors))).isFalse();
    assertThat(gate.isRelevant("do fire doors close?", List.of(doors))).isTrue();
  }
}
