package dev.regula.answer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnswerSchemaTest {

  private final AnswerSchema schema = new AnswerSchema(AnswerProperties.defaults());

  private static AnswerContent content(String title, String summary) {
    return new AnswerContent(title, summary, List.of("Close the door"), List.of("Page 5 says so"));
  }

  private static AnswerResponse response(
      AnswerContent content, List<String> links, List<String> images) {
    return new AnswerResponse("answer", content, links, new MediaRefs(images), 0);
  }

  @Test
  void wellFormedAnswerHasNoViolations() {
    AnswerResponse valid =
        response(
            content("Fire door rules", "Fire doors must be self-closing."),
            List.of("/media/page_5.png"),
            List.of("Diagram 3.2"));

    assertThat(schema.violations(valid)).isEmpty();
  }

  @Test
  void noInformationAnswerIsWellFormed() {
    assertThat(schema.violations(AnswerResponse.noInformation(12))).isEmpty();
  }

  @Test
  void reportsEveryMissingTopLevelField() {
    AnswerResponse empty = new AnswerResponse(null, null, null, null, 0);

    assertThat(schema.violations(empty))
        .containsExactlyInAnyOrder(
            "Missing required field: mode",
            "Missing required field: links",
            "Missing required field: media.images",
            "Missing required field: answer");
  }

  @Test
  void unexpectedModeIsReported() {
    AnswerResponse chat =
        new AnswerResponse(
            "chat",
            content("Fire door rules", "Fire doors close."),
            List.of(),
            new MediaRefs(List.of()),
            0);

    assertThat(schema.violations(chat)).containsExactly("Unexpected mode: chat");
  }

  @Test
  void shortTitleAndSummaryAreReported() {
    AnswerResponse terse = response(content("Hi", "Short"), List.of(), List.of());

    assertThat(schema.violations(terse))
        .containsExactly("Title too short or empty", "Summary too short or empty");
  }

  @Test
  void whitespaceIsIgnoredWhenMeasuringLengths() {
    AnswerResponse padded = response(content("   Hi   ", "     ok     "), List.of(), List.of());

    assertThat(schema.violations(padded)).hasSize(2);
  }

  @Test
  void overlongSummaryIsReported() {
    AnswerResponse verbose =
        response(content("Fire door rules", "x".repeat(2001)), List.of(), List.of());

    assertThat(schema.violations(verbose)).containsExactly("Answer too long (max 2000 chars)");
  }

  @Test
  void linkCountAndFormatAreChecked() {
    List<String> links = new ArrayList<>(Collections.nCopies(10, "/media/page_1.png"));
    links.add("https://example.com/page_2.png");

    AnswerResponse crowded = response(content("Fire door rules", "Doors close."), links, List.of());

    assertThat(schema.violations(crowded))
        .containsExactlyInAnyOrder(
            "Too many links (max 10)", "Invalid link format: https://example.com/page_2.png");
  }

  @Test
  void mediaCountAndNullEntriesAreChecked() {
    List<String> images = Arrays.asList("D1", "D2", "D3", "D4", "D5", null);

    AnswerResponse crowded =
        response(content("Fire door rules", "Doors close."), List.of(), images);

    assertThat(schema.violations(crowded))
        .containsExactlyInAnyOrder("Too many media files (max 5)", "Null media reference");
  }

  @Test
  void stepsAndVerificationMustBePresent() {
    AnswerContent partial = new AnswerContent("Fire door rules", "Doors close.", null, null);

    assertThat(schema.violations(response(partial, List.of(), List.of())))
        .containsExactly(
            "Missing required answer field: steps", "Missing required answer field: verification");
  }

  @Test
  void tooManyStepsIsReported() {
    AnswerContent longWinded =
        new AnswerContent(
            "Fire door rules", "Doors close.", Collections.nCopies(11, "step"), List.of());

    assertThat(schema.violations(response(longWinded, List.of(), List.of())))
        .containsExactly("Too many steps (max 10)");
  }
}
