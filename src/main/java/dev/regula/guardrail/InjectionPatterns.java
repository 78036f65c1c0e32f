package dev.regula.guardrail;

import java.text.Normalizer;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** Known prompt-injection phrasings, matched case-insensitively after NFKC normalization. */
final class InjectionPatterns {

  private static final List<Pattern> PATTERNS =
      List.of(
          compile("ignore\\s+.*(previous|above|all).*instructions?"),
          compile("you\\s+are\\s+now"),
          compile("new\\s+instructions?"),
          compile("system\\s*:\\s*you"),
          compile("<\\s*script\\s*>"),
          compile("javascript:"),
          compile("eval\\s*\\("),
          compile("exec\\s*\\("),
          compile("__import__"),
          compile("forget\\s+(everything|all)"),
          compile("disregard\\s+(previous|above)"),
          compile("override\\s+your"),
          compile("new\\s+role"),
          compile("act\\s+as\\s+if"));

  private InjectionPatterns() {}

  /**
   * Returns the first pattern found in the text.
   *
   * @param text raw user input
   * @return the matching pattern's source, empty if none matches
   */
  static Optional<String> firstMatch(String text) {
    // Fullwidth and other compatibility forms fold to ASCII
    String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
    return PATTERNS.stream()
        .filter(p -> p.matcher(normalized).find())
        .map(Pattern::pattern)
        .findFirst();
  }

  private static Pattern compile(String regex) {
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
