package dev.regula.answer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The body of an answer.
 *
 * <p>Components are nullable because instances are first read from model output; {@link
 * AnswerSchema} reports missing fields before a response leaves the generator.
 *
 * @param title short headline
 * @param summary the answer text
 * @param steps actionable steps, in order
 * @param verification how the cited pages support the answer
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnswerContent(
    @Nullable String title,
    @Nullable String summary,
    @Nullable List<String> steps,
    @Nullable List<String> verification) {

  public AnswerContent {
    steps = steps == null ? null : Collections.unmodifiableList(new ArrayList<>(steps));
    verification =
        verification == null ? null : Collections.unmodifiableList(new ArrayList<>(verification));
  }
}
