package dev.regula.rerank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Reranker settings, bound from {@code regula.rerank.*}.
 *
 * @param maxPassageChars characters of each candidate text included in the prompt
 */
@ConfigurationProperties(prefix = "regula.rerank")
public record RerankProperties(@DefaultValue("1000") int maxPassageChars) {

  public RerankProperties {
    if (maxPassageChars < 1) {
      throw new IllegalStateException(
          "regula.rerank.max-passage-chars must be at least 1, got: " + maxPassageChars);
    }
  }
}
