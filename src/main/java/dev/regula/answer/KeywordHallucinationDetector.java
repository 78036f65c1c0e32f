package dev.regula.answer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Flags answers whose summary or verification contains a hedge phrase such as "general
 * knowledge". Matching is a case-insensitive substring test; the context is not consulted.
 */
@Component
public class KeywordHallucinationDetector implements HallucinationDetector {

  private final List<String> phrases;

  public KeywordHallucinationDetector(AnswerProperties properties) {
    this.phrases =
        properties.hedgePhrases().stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
  }

  @Override
  public Optional<String> detect(AnswerContent answer, String context) {
    StringBuilder scanned = new StringBuilder();
    if (answer.summary() != null) {
      scanned.append(answer.summary()).append('\n');
    }
    if (answer.verification() != null) {
      for (String entry : answer.verification()) {
        if (entry != null) {
          scanned.append(entry).append('\n');
        }
      }
    }
    String text = scanned.toString().toLowerCase(Locale.ROOT);
    return phrases.stream()
        .filter(text::contains)
        .findFirst()
        .map(phrase -> "hedge phrase '" + phrase + "'");
  }
}
