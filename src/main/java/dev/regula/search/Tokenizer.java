package dev.regula.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Lowercasing word tokenizer shared by the lexical index and the relevance gate.
 *
 * <p>Splits on anything that is not a letter or digit and drops a small set of English function
 * words, so that "What are the requirements?" yields {@code [requirements]}.
 */
public final class Tokenizer {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");

  static final Set<String> STOPWORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "can", "do", "does", "for", "from",
          "how", "i", "if", "in", "into", "is", "it", "its", "me", "my", "of", "on", "or", "should",
          "that", "the", "their", "there", "these", "this", "to", "was", "what", "when", "where",
          "which", "who", "why", "will", "with", "you", "your");

  private Tokenizer() {}

  /**
   * Tokenizes text into lowercase terms, stopwords removed.
   *
   * @param text input text (null yields no tokens)
   * @return terms in text order, duplicates kept
   */
  public static List<String> tokenize(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String part : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!part.isEmpty() && !STOPWORDS.contains(part)) {
        tokens.add(part);
      }
    }
    return tokens;
  }
}
