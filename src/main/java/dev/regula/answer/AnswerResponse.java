package dev.regula.answer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A structured answer as returned to the caller.
 *
 * <p>The same type is used to read the model's JSON output, so components may be null until the
 * response has passed {@link AnswerSchema}.
 *
 * @param mode always {@value #MODE} once validated
 * @param answer title, summary, steps and verification
 * @param links cited page images, each under {@code /media/}
 * @param media cited diagrams
 * @param latencyMs end-to-end processing time, set by the pipeline
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnswerResponse(
    @Nullable String mode,
    @Nullable AnswerContent answer,
    @Nullable List<String> links,
    @Nullable MediaRefs media,
    @JsonProperty("latency_ms") long latencyMs) {

  public static final String MODE = "answer";
  public static final String NO_INFORMATION_TITLE = "No Information Found";
  public static final String NO_INFORMATION_SUMMARY =
      "No relevant information was found in the documentation.";

  public AnswerResponse {
    links = links == null ? null : Collections.unmodifiableList(new ArrayList<>(links));
  }

  /**
   * The canonical answer for questions the retrieved context cannot support: fixed title and
   * summary, everything else empty.
   *
   * @param latencyMs processing time to report
   * @return the no-information answer
   */
  public static AnswerResponse noInformation(long latencyMs) {
    return new AnswerResponse(
        MODE,
        new AnswerContent(NO_INFORMATION_TITLE, NO_INFORMATION_SUMMARY, List.of(), List.of()),
        List.of(),
        new MediaRefs(List.of()),
        latencyMs);
  }

  public AnswerResponse withLatencyMs(long latencyMs) {
    return new AnswerResponse(mode, answer, links, media, latencyMs);
  }

  AnswerResponse withReferences(@Nullable List<String> links, @Nullable List<String> images) {
    return new AnswerResponse(MODE, answer, links, new MediaRefs(images), latencyMs);
  }

  /** Images of {@link #media()}, empty when absent. */
  public List<String> images() {
    return media == null || media.images() == null ? List.of() : media.images();
  }

  /** True if this is the canonical no-information answer. */
  @JsonIgnore
  public boolean isNoInformation() {
    return answer != null && NO_INFORMATION_TITLE.equals(answer.title());
  }
}
