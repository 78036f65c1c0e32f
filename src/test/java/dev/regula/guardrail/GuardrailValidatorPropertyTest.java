package dev.regula.guardrail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.regula.answer.AnswerProperties;
import dev.regula.answer.AnswerSchema;
import java.util.regex.Pattern;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

class GuardrailValidatorPropertyTest {

  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");
  private static final Pattern REPEATED_WHITESPACE = Pattern.compile("\\s{2,}");

  private final GuardrailValidator validator =
      new GuardrailValidator(
          GuardrailProperties.defaults(), new AnswerSchema(AnswerProperties.defaults()));

  @Provide
  Arbitrary<String> hostileText() {
    return Arbitraries.strings()
        .withChars("<>{}[]\\/ \t\n\r\u0000\u0007\u001b\u007f\u0085abcXYZ019.,")
        .ofMaxLength(80);
  }

  @Provide
  Arbitrary<String> plainQuestions() {
    return Arbitraries.strings()
        .withCharRange('a', 'z')
        .withChars(' ', '?', ',')
        .ofMinLength(5)
        .ofMaxLength(200)
        .filter(q -> q.strip().length() >= 5)
        .filter(q -> InjectionPatterns.firstMatch(q).isEmpty());
  }

  @Property
  void sanitizedInputHasNoTagsControlCharactersOrRepeatedWhitespace(
      @ForAll("hostileText") String raw) {
    String sanitized = GuardrailValidator.sanitizeInput(raw);

    assertThat(TAG.matcher(sanitized).find()).isFalse();
    assertThat(CONTROL.matcher(sanitized).find()).isFalse();
    assertThat(REPEATED_WHITESPACE.matcher(sanitized).find()).isFalse();
    assertThat(sanitized).doesNotContain("{", "}", "[", "]", "\\");
    assertThat(sanitized).isEqualTo(sanitized.strip());
  }

  @Property
  void sanitizingIsIdempotent(@ForAll("hostileText") String raw) {
    String once = GuardrailValidator.sanitizeInput(raw);

    assertThat(GuardrailValidator.sanitizeInput(once)).isEqualTo(once);
  }

  @Property
  void plainQuestionsPassWithWhitespaceCollapsed(@ForAll("plainQuestions") String query) {
    String validated = validator.validateInput(query);

    assertThat(validated).isNotBlank();
    assertThat(validated).isEqualTo(query.strip().replaceAll("\\s+", " "));
  }

  @Property
  void queriesOutsideLengthBoundsAreAlwaysRejected(
      @ForAll @IntRange(min = 501, max = 2000) int longLength,
      @ForAll @IntRange(min = 1, max = 4) int shortLength) {
    String longQuery = "fire-doors".repeat(longLength / 10 + 1).substring(0, longLength);
    String shortQuery = "  " + "exits".substring(0, shortLength) + "  ";

    assertThatThrownBy(() -> validator.validateInput(longQuery))
        .isInstanceOf(GuardrailViolationException.class)
        .hasMessageStartingWith("Query too long");
    assertThatThrownBy(() -> validator.validateInput(shortQuery))
        .isInstanceOf(GuardrailViolationException.class)
        .hasMessageStartingWith("Query too short");
  }
}
