package dev.regula.llm;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat model settings, bound from {@code regula.llm.*}. Any OpenAI-compatible endpoint works
 * (OpenAI, Groq, a local server).
 *
 * @param baseUrl endpoint base URL
 * @param apiKey provider API key; required
 * @param modelName chat model name
 * @param temperature sampling temperature for every call
 * @param timeoutMs connection/response timeout per call
 * @param retry retry policy for transient failures
 */
@ConfigurationProperties(prefix = "regula.llm")
public record LlmProperties(
    String baseUrl,
    @Nullable String apiKey,
    String modelName,
    double temperature,
    long timeoutMs,
    Retry retry) {

  public LlmProperties {
    if (timeoutMs <= 0) {
      throw new IllegalStateException("regula.llm.timeout-ms must be positive, got: " + timeoutMs);
    }
    if (retry == null || retry.maxAttempts() < 1) {
      throw new IllegalStateException("regula.llm.retry.max-attempts must be at least 1");
    }
  }

  public record Retry(int maxAttempts, long delayMs, double multiplier, long maxDelayMs) {}
}
