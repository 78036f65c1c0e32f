package dev.regula.answer;

import dev.regula.llm.CompletionRequest;
import dev.regula.llm.JsonExtractionException;
import dev.regula.llm.LenientJsonParser;
import dev.regula.llm.LlmProperties;
import dev.regula.llm.TextGenerationClient;
import dev.regula.llm.TextGenerationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces a structured, reference-grounded answer from the assembled context.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>one completion at the configured temperature (retried by the {@link TextGenerationClient})
 *   <li>lenient JSON parse of the output
 *   <li>hallucination check; a positive result replaces the answer with {@link
 *       AnswerResponse#noInformation}
 *   <li>reference filtering: links and images not in the allowed sets are dropped, never fatal
 *   <li>schema validation with {@link AnswerSchema}
 * </ol>
 *
 * <p>Everything except the two fallbacks in steps 3 and 4 fails with {@link GenerationException}.
 */
@Service
public class AnswerGenerator {

  private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);

  private final TextGenerationClient textGenerationClient;
  private final LenientJsonParser jsonParser;
  private final HallucinationDetector hallucinationDetector;
  private final AnswerSchema answerSchema;
  private final double temperature;

  public AnswerGenerator(
      TextGenerationClient textGenerationClient,
      LenientJsonParser jsonParser,
      HallucinationDetector hallucinationDetector,
      AnswerSchema answerSchema,
      LlmProperties llmProperties) {
    this.textGenerationClient = textGenerationClient;
    this.jsonParser = jsonParser;
    this.hallucinationDetector = hallucinationDetector;
    this.answerSchema = answerSchema;
    this.temperature = llmProperties.temperature();
  }

  /**
   * Generates the answer.
   *
   * @param query the sanitized question
   * @param context the sanitized context
   * @param allowedPages page links the answer may cite
   * @param allowedMedia diagram references the answer may cite
   * @return a schema-valid answer whose references are subsets of the allowed sets; latency is 0
   * @throws IllegalArgumentException if query or context is blank
   * @throws GenerationException if the provider fails, the output is unparsable, or the filtered
   *     answer is structurally invalid
   */
  public AnswerResponse generate(
      String query, String context, List<String> allowedPages, List<String> allowedMedia) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be empty");
    }
    if (context == null || context.isBlank()) {
      throw new IllegalArgumentException("Context must not be empty");
    }

    CompletionRequest request =
        new CompletionRequest(
            AnswerPrompts.SYSTEM_PROMPT,
            AnswerPrompts.userPrompt(query, context, allowedPages, allowedMedia),
            temperature);

    String raw;
    try {
      raw = textGenerationClient.complete(request);
    } catch (TextGenerationException e) {
      throw new GenerationException("Answer generation failed after retries", e);
    }

    AnswerResponse parsed;
    try {
      parsed = jsonParser.parse(raw, AnswerResponse.class);
    } catch (JsonExtractionException e) {
      throw new GenerationException("Answer output is not valid JSON", e);
    }

    if (parsed.answer() != null) {
      Optional<String> hallucination = hallucinationDetector.detect(parsed.answer(), context);
      if (hallucination.isPresent()) {
        log.warn(
            "Hallucination detected ({}), returning the no-information answer",
            hallucination.get());
        return AnswerResponse.noInformation(0);
      }
    }

    List<String> citedImages = parsed.media() == null ? null : parsed.media().images();
    AnswerResponse filtered =
        parsed.withReferences(
            keepAllowed("link", parsed.links(), allowedPages),
            keepAllowed("image", citedImages, allowedMedia));

    List<String> violations = answerSchema.violations(filtered);
    if (!violations.isEmpty()) {
      throw new GenerationException("Answer failed schema validation: " + violations);
    }
    return filtered.withLatencyMs(0);
  }

  /**
   * Keeps the cited references that are in the allowed set, in model order, without duplicates.
   * Returns null when the model omitted the field so that schema validation reports it.
   */
  private static @Nullable List<String> keepAllowed(
      String kind, @Nullable Collection<String> cited, Collection<String> allowed) {
    if (cited == null) {
      return null;
    }
    Set<String> allowedSet = new HashSet<>(allowed);
    Set<String> kept = new LinkedHashSet<>();
    for (String reference : cited) {
      if (reference != null && allowedSet.contains(reference)) {
        kept.add(reference);
      } else {
        log.warn("Dropped {} not in the retrieved set: {}", kind, reference);
      }
    }
    return new ArrayList<>(kept);
  }
}
