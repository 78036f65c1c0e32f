package dev.regula.answer;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Answer schema limits and hallucination phrases, bound from {@code regula.answer.*}. Shared by
 * the generator and the output guardrail.
 *
 * @param minTitleLength minimum trimmed title length
 * @param minSummaryLength minimum trimmed summary length
 * @param maxSummaryLength maximum trimmed summary length
 * @param maxSteps maximum number of steps
 * @param maxLinks maximum number of page links
 * @param maxMedia maximum number of images
 * @param linkPrefix required prefix of every link
 * @param hedgePhrases phrases that signal the model answered from outside the context
 */
@ConfigurationProperties(prefix = "regula.answer")
public record AnswerProperties(
    @DefaultValue("5") int minTitleLength,
    @DefaultValue("10") int minSummaryLength,
    @DefaultValue("2000") int maxSummaryLength,
    @DefaultValue("10") int maxSteps,
    @DefaultValue("10") int maxLinks,
    @DefaultValue("5") int maxMedia,
    @DefaultValue("/media/") String linkPrefix,
    @DefaultValue({
          "general knowledge",
          "common knowledge",
          "does not provide any information",
          "context does not contain",
          "outside the provided context",
          "not mentioned in the context",
          "based on my knowledge"
        })
        List<String> hedgePhrases) {

  public AnswerProperties {
    if (minSummaryLength > maxSummaryLength) {
      throw new IllegalStateException(
          "regula.answer.min-summary-length must not exceed max-summary-length");
    }
    if (maxSteps < 0 || maxLinks < 0 || maxMedia < 0) {
      throw new IllegalStateException("regula.answer limits must not be negative");
    }
    hedgePhrases = hedgePhrases == null ? List.of() : List.copyOf(hedgePhrases);
  }

  /** Defaults, for code paths built outside Spring. */
  public static AnswerProperties defaults() {
    return new AnswerProperties(
        5,
        10,
        2000,
        10,
        10,
        5,
        "/media/",
        List.of(
            "general knowledge",
            "common knowledge",
            "does not provide any information",
            "context does not contain",
            "outside the provided context",
            "not mentioned in the context",
            "based on my knowledge"));
  }
}
