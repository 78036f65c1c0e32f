package dev.regula.guardrail;

import dev.regula.answer.AnswerResponse;
import dev.regula.answer.AnswerSchema;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stateless policy checks at the three pipeline boundaries: the raw question, the assembled
 * context, and the generated answer. Every failure is a {@link GuardrailViolationException}.
 *
 * <p>Output checks run in one of two modes chosen by the caller. Lenient mode checks the shape of
 * each reference (links under {@code /media/}, images under {@code /media/} or labelled {@code
 * "Diagram ..."}); strict mode additionally requires every reference to be in the allowed sets.
 */
@Component
public class GuardrailValidator {

  private static final Logger log = LoggerFactory.getLogger(GuardrailValidator.class);

  static final String DIAGRAM_LABEL_PREFIX = "Diagram ";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");
  private static final Pattern TAGS = Pattern.compile("<[^>]+>");
  private static final Pattern INJECTION_CHARS = Pattern.compile("[{}\\[\\]\\\\]");

  private final GuardrailProperties properties;
  private final AnswerSchema answerSchema;

  public GuardrailValidator(GuardrailProperties properties, AnswerSchema answerSchema) {
    this.properties = properties;
    this.answerSchema = answerSchema;
  }

  /**
   * Validates and sanitizes a raw question.
   *
   * <p>Length and injection checks run on the raw text; the returned text has markup, control
   * characters and the characters {@code { } [ ] \} removed, with whitespace collapsed.
   *
   * @param query raw user input
   * @return the sanitized query, never blank
   * @throws GuardrailViolationException if the query is missing, out of bounds, or suspicious
   */
  public String validateInput(@Nullable String query) {
    if (query == null || query.isBlank()) {
      throw violation("Input", "Query must be a non-empty string");
    }

    int length = query.strip().length();
    if (length < properties.minQueryLength()) {
      throw violation("Input", "Query too short (min " + properties.minQueryLength() + " chars)");
    }
    if (length > properties.maxQueryLength()) {
      throw violation("Input", "Query too long (max " + properties.maxQueryLength() + " chars)");
    }

    if (properties.injectionDetection()) {
      Optional<String> pattern = InjectionPatterns.firstMatch(query);
      if (pattern.isPresent()) {
        log.warn("Injection attempt detected: {}", pattern.get());
        throw violation("Input", "Query contains suspicious patterns and was blocked for security");
      }
    }

    String sanitized = sanitizeInput(query);
    if (sanitized.isEmpty()) {
      throw violation("Input", "Query is empty after sanitization");
    }
    return sanitized;
  }

  /**
   * Validates and sanitizes the assembled context.
   *
   * <p>Markup is stripped with jsoup; script and style bodies are dropped, text and line breaks are
   * kept. A context shorter than {@code min-context-length} is only logged.
   *
   * @param context assembled context
   * @return the sanitized context
   * @throws GuardrailViolationException if the context is empty or longer than the maximum
   */
  public String validateContext(@Nullable String context) {
    if (context == null || context.isBlank()) {
      throw violation("Context", "Context is empty");
    }
    if (context.length() > properties.maxContextLength()) {
      throw violation(
          "Context", "Context too long (max " + properties.maxContextLength() + " chars)");
    }

    String sanitized = sanitizeContext(context);
    if (sanitized.isBlank()) {
      throw violation("Context", "Context is empty after sanitization");
    }
    if (sanitized.length() < properties.minContextLength()) {
      log.warn("Context very short: {} chars", sanitized.length());
    }
    return sanitized;
  }

  /**
   * Checks a generated answer's structure and references.
   *
   * @param response the answer to check
   * @param allowedPages page links derived from the selected chunks
   * @param allowedMedia diagram references derived from the selected chunks
   * @param strict whether every reference must be in the allowed sets
   * @throws GuardrailViolationException on the first rule broken
   */
  public void validateOutput(
      AnswerResponse response,
      Collection<String> allowedPages,
      Collection<String> allowedMedia,
      boolean strict) {
    List<String> structural = answerSchema.violations(response);
    if (!structural.isEmpty()) {
      throw violation("Output", structural.get(0));
    }

    Set<String> pages = new HashSet<>(allowedPages);
    for (String link : response.links()) {
      if (strict && !pages.contains(link)) {
        throw violation("Output", "Invalid page reference: " + link);
      }
    }

    Set<String> media = new HashSet<>(allowedMedia);
    for (String image : response.images()) {
      if (!image.startsWith("/media/") && !isDiagramLabel(image)) {
        throw violation("Output", "Invalid media format: " + image);
      }
      if (strict && !media.contains(image)) {
        throw violation("Output", "Invalid media reference: " + image);
      }
    }
  }

  // Diagram labels come from a case-insensitive match over page text, so "DIAGRAM 3.2" is valid.
  private static boolean isDiagramLabel(String image) {
    return image.regionMatches(true, 0, DIAGRAM_LABEL_PREFIX, 0, DIAGRAM_LABEL_PREFIX.length());
  }

  /** Applies the output mode configured in {@code regula.guardrail.strict-output}. */
  public void validateOutput(
      AnswerResponse response, Collection<String> allowedPages, Collection<String> allowedMedia) {
    validateOutput(response, allowedPages, allowedMedia, properties.strictOutput());
  }

  static String sanitizeInput(String query) {
    String text = WHITESPACE.matcher(query).replaceAll(" ");
    text = CONTROL_CHARS.matcher(text).replaceAll("");
    text = TAGS.matcher(text).replaceAll("");
    text = INJECTION_CHARS.matcher(text).replaceAll("");
    text = WHITESPACE.matcher(text).replaceAll(" ");
    return text.strip();
  }

  static String sanitizeContext(String context) {
    String cleaned =
        Jsoup.clean(context, "", Safelist.none(), new Document.OutputSettings().prettyPrint(false));
    return Parser.unescapeEntities(cleaned, false).strip();
  }

  private static GuardrailViolationException violation(String boundary, String reason) {
    log.warn("{} guardrail violation: {}", boundary, reason);
    return new GuardrailViolationException(reason);
  }
}
