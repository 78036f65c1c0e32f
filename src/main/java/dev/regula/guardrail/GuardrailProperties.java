package dev.regula.guardrail;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Guardrail limits, bound from {@code regula.guardrail.*}. Answer schema limits live in {@code
 * regula.answer.*}.
 *
 * @param minQueryLength minimum trimmed query length
 * @param maxQueryLength maximum trimmed query length
 * @param minContextLength contexts shorter than this are logged, not rejected
 * @param maxContextLength contexts longer than this are rejected
 * @param strictOutput require every cited reference to be in the allowed sets
 * @param injectionDetection reject queries matching known prompt-injection patterns
 */
@ConfigurationProperties(prefix = "regula.guardrail")
public record GuardrailProperties(
    @DefaultValue("5") int minQueryLength,
    @DefaultValue("500") int maxQueryLength,
    @DefaultValue("50") int minContextLength,
    @DefaultValue("50000") int maxContextLength,
    @DefaultValue("false") boolean strictOutput,
    @DefaultValue("true") boolean injectionDetection) {

  public GuardrailProperties {
    if (minQueryLength < 1 || minQueryLength > maxQueryLength) {
      throw new IllegalStateException(
          "regula.guardrail query length bounds are invalid: ["
              + minQueryLength
              + ", "
              + maxQueryLength
              + "]");
    }
    if (minContextLength < 0 || minContextLength > maxContextLength) {
      throw new IllegalStateException(
          "regula.guardrail context length bounds are invalid: ["
              + minContextLength
              + ", "
              + maxContextLength
              + "]");
    }
  }

  /** Defaults, for code paths built outside Spring. */
  public static GuardrailProperties defaults() {
    return new GuardrailProperties(5, 500, 50, 50000, false, true);
  }
}
