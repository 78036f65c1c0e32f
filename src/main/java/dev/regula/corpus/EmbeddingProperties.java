package dev.regula.corpus;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Embedding provider settings, bound from {@code regula.embedding.*}.
 *
 * <p>{@code provider} selects the {@code EmbeddingModel} bean: {@code bge-small} runs the
 * quantized bge-small-en-v1.5 model in-process, {@code openai} calls an OpenAI-compatible
 * embeddings endpoint. The snapshot must have been built with the same provider.
 *
 * @param provider embedding backend name
 * @param modelName remote model name (openai provider only)
 * @param baseUrl remote endpoint (openai provider only; null means the OpenAI default)
 * @param apiKey remote API key (openai provider only)
 * @param timeoutMs remote call timeout in milliseconds
 * @param queryPrefix text prepended to queries (not to documents) before embedding
 * @param batchSize number of texts per embedding call when building a snapshot
 */
@ConfigurationProperties(prefix = "regula.embedding")
public record EmbeddingProperties(
    @DefaultValue("bge-small") String provider,
    @DefaultValue("text-embedding-3-small") String modelName,
    @Nullable String baseUrl,
    @Nullable String apiKey,
    @DefaultValue("30000") int timeoutMs,
    @DefaultValue("") String queryPrefix,
    @DefaultValue("64") int batchSize) {

  public EmbeddingProperties {
    if (batchSize < 1) {
      throw new IllegalStateException(
          "regula.embedding.batch-size must be at least 1, got: " + batchSize);
    }
    if (queryPrefix == null) {
      queryPrefix = "";
    }
  }
}
