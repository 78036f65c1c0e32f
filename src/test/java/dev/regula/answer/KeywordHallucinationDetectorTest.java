package dev.regula.answer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordHallucinationDetectorTest {

  private final KeywordHallucinationDetector detector =
      new KeywordHallucinationDetector(AnswerProperties.defaults());

  private static final String CONTEXT = "[Page 5]\nFire doors must be self-closing.";

  @Test
  void groundedAnswerPasses() {
    AnswerContent grounded =
        new AnswerContent(
            "Fire doors",
            "Fire doors must be self-closing.",
            List.of("Check the closer"),
            List.of("Page 5 states the requirement"));

    assertThat(detector.detect(grounded, CONTEXT)).isEmpty();
  }

  @Test
  void hedgePhraseInSummaryIsFlaggedCaseInsensitively() {
    AnswerContent hedged =
        new AnswerContent("Fire doors", "This is based on Common Knowledge.", List.of(), List.of());

    assertThat(detector.detect(hedged, CONTEXT)).contains("hedge phrase 'common knowledge'");
  }

  @Test
  void hedgePhraseInVerificationIsFlagged() {
    AnswerContent hedged =
        new AnswerContent(
            "Fire doors",
            "Doors must close.",
            List.of(),
            List.of("The context does not contain this detail"));

    assertThat(detector.detect(hedged, CONTEXT)).isPresent();
  }

  @Test
  void stepsAreNotScanned() {
    AnswerContent steps =
        new AnswerContent(
            "Fire doors",
            "Doors must close.",
            List.of("Use general knowledge of hinges"),
            List.of());

    assertThat(detector.detect(steps, CONTEXT)).isEmpty();
  }

  @Test
  void missingFieldsAreTolerated() {
    assertThat(detector.detect(new AnswerContent(null, null, null, null), CONTEXT)).isEmpty();
  }
}
