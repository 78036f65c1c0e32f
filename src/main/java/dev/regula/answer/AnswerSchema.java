package dev.regula.answer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Structural checks on an {@link AnswerResponse}: required fields present and within the limits
 * of {@link AnswerProperties}. Reference membership is not checked here.
 */
@Component
public class AnswerSchema {

  private final AnswerProperties properties;

  public AnswerSchema(AnswerProperties properties) {
    this.properties = properties;
  }

  /**
   * Lists every rule the response breaks.
   *
   * @param response the response to check
   * @return human-readable violations, empty if the response is well formed
   */
  public List<String> violations(AnswerResponse response) {
    List<String> violations = new ArrayList<>();

    if (response.mode() == null) {
      violations.add("Missing required field: mode");
    } else if (!AnswerResponse.MODE.equals(response.mode())) {
      violations.add("Unexpected mode: " + response.mode());
    }
    if (response.links() == null) {
      violations.add("Missing required field: links");
    }
    if (response.media() == null || response.media().images() == null) {
      violations.add("Missing required field: media.images");
    }

    AnswerContent answer = response.answer();
    if (answer == null) {
      violations.add("Missing required field: answer");
    } else {
      checkContent(answer, violations);
    }

    List<String> links = response.links();
    if (links != null) {
      if (links.size() > properties.maxLinks()) {
        violations.add("Too many links (max " + properties.maxLinks() + ")");
      }
      for (String link : links) {
        if (link == null || !link.startsWith(properties.linkPrefix())) {
          violations.add("Invalid link format: " + link);
        }
      }
    }

    List<String> images = response.images();
    if (images.size() > properties.maxMedia()) {
      violations.add("Too many media files (max " + properties.maxMedia() + ")");
    }
    if (images.stream().anyMatch(Objects::isNull)) {
      violations.add("Null media reference");
    }
    return violations;
  }

  private void checkContent(AnswerContent answer, List<String> violations) {
    String title = answer.title() == null ? "" : answer.title().strip();
    if (title.length() < properties.minTitleLength()) {
      violations.add("Title too short or empty");
    }

    String summary = answer.summary() == null ? "" : answer.summary().strip();
    if (summary.length() < properties.minSummaryLength()) {
      violations.add("Summary too short or empty");
    } else if (summary.length() > properties.maxSummaryLength()) {
      violations.add("Answer too long (max " + properties.maxSummaryLength() + " chars)");
    }

    if (answer.steps() == null) {
      violations.add("Missing required answer field: steps");
    } else {
      if (answer.steps().size() > properties.maxSteps()) {
        violations.add("Too many steps (max " + properties.maxSteps() + ")");
      }
      if (answer.steps().contains(null)) {
        violations.add("Null step");
      }
    }
    if (answer.verification() == null) {
      violations.add("Missing required answer field: verification");
    } else if (answer.verification().contains(null)) {
      violations.add("Null verification entry");
    }
  }
}
