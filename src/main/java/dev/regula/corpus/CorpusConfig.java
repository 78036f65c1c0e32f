package dev.regula.corpus;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the loaded snapshot as read-only beans shared by every request.
 *
 * <p>The snapshot is loaded exactly once, when the context starts. Nothing in the application
 * writes to these beans afterwards.
 */
@Configuration
public class CorpusConfig {

  @Bean
  public IndexSnapshot indexSnapshot(IndexSnapshotLoader loader) {
    return loader.load();
  }

  @Bean
  public ChunkStore chunkStore(IndexSnapshot indexSnapshot) {
    return indexSnapshot.chunkStore();
  }

  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(IndexSnapshot indexSnapshot) {
    return indexSnapshot.embeddingStore();
  }
}
