package dev.regula.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.regula.corpus.EmbeddingProperties;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model used both to build the snapshot and to embed queries.
 *
 * <p>{@code regula.embedding.provider} selects the backend. The default {@code bge-small} runs the
 * quantized bge-small-en-v1.5 model (384 dimensions) in-process, avoiding any external embedding
 * API; {@code openai} calls an OpenAI-compatible embeddings endpoint. A snapshot is only usable
 * with the provider that built it.
 */
@Configuration
public class EmbeddingConfig {

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  @ConditionalOnProperty(
      name = "regula.embedding.provider",
      havingValue = "bge-small",
      matchIfMissing = true)
  public EmbeddingModel bgeSmallEmbeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Provides a remote OpenAI-compatible embedding model.
   *
   * @param properties model name, endpoint, key and timeout
   * @return the remote embedding model
   * @throws IllegalStateException if no API key is configured
   */
  @Bean
  @ConditionalOnProperty(name = "regula.embedding.provider", havingValue = "openai")
  public EmbeddingModel openAiEmbeddingModel(EmbeddingProperties properties) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new IllegalStateException(
          "regula.embedding.api-key is required when regula.embedding.provider=openai");
    }
    return OpenAiEmbeddingModel.builder()
        .baseUrl(properties.baseUrl())
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .timeout(Duration.ofMillis(properties.timeoutMs()))
        .build();
  }
}
