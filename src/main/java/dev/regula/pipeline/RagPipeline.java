package dev.regula.pipeline;

import dev.regula.answer.AnswerGenerator;
import dev.regula.answer.AnswerResponse;
import dev.regula.guardrail.GuardrailValidator;
import dev.regula.guardrail.GuardrailViolationException;
import dev.regula.rerank.LlmReranker;
import dev.regula.rerank.RankedChunk;
import dev.regula.search.CandidateResult;
import dev.regula.search.HybridRetriever;
import dev.regula.search.RetrievalProperties;
import java.time.Clock;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one question through the whole pipeline: input guardrail, hybrid retrieval, reranking,
 * context assembly, relevance gate, context guardrail, generation and output guardrail.
 *
 * <p>Stages run sequentially on the calling thread. The latency budget is checked before each
 * stage; a stage already in progress is bounded only by its own provider timeout. A failing stage
 * is logged with the query prefix and rethrown unchanged.
 *
 * <p>The only non-error early exit is the relevance gate: when the selected context shares no term
 * with the question, the canonical no-information answer is returned without calling the
 * generator.
 */
@Service
public class RagPipeline {

  private static final Logger log = LoggerFactory.getLogger(RagPipeline.class);

  static final int LOGGED_QUERY_PREFIX = 60;

  private final GuardrailValidator guardrailValidator;
  private final HybridRetriever hybridRetriever;
  private final LlmReranker reranker;
  private final ContextAssembler contextAssembler;
  private final RelevanceGate relevanceGate;
  private final AnswerGenerator answerGenerator;
  private final RetrievalProperties retrievalProperties;
  private final PipelineProperties pipelineProperties;
  private final Clock clock;

  public RagPipeline(
      GuardrailValidator guardrailValidator,
      HybridRetriever hybridRetriever,
      LlmReranker reranker,
      ContextAssembler contextAssembler,
      RelevanceGate relevanceGate,
      AnswerGenerator answerGenerator,
      RetrievalProperties retrievalProperties,
      PipelineProperties pipelineProperties,
      Clock clock) {
    this.guardrailValidator = guardrailValidator;
    this.hybridRetriever = hybridRetriever;
    this.reranker = reranker;
    this.contextAssembler = contextAssembler;
    this.relevanceGate = relevanceGate;
    this.answerGenerator = answerGenerator;
    this.retrievalProperties = retrievalProperties;
    this.pipelineProperties = pipelineProperties;
    this.clock = clock;
  }

  /**
   * Answers a question.
   *
   * @param question raw user input
   * @return a grounded answer, or the canonical no-information answer; latency is filled in
   * @throws GuardrailViolationException if the question, context or answer breaks a policy
   * @throws PipelineTimeoutException if the latency budget runs out between stages
   * @throws RuntimeException the unchanged failure of any other stage
   */
  public AnswerResponse answer(@Nullable String question) {
    long start = clock.millis();
    String loggedQuery = prefix(question);
    PipelineStage stage = PipelineStage.INPUT_VALIDATION;

    try {
      String query = guardrailValidator.validateInput(question);
      loggedQuery = prefix(query);

      stage = enter(PipelineStage.RETRIEVAL, start);
      List<CandidateResult> candidates =
          hybridRetriever.retrieve(query, retrievalProperties.getCandidateK());

      stage = enter(PipelineStage.RERANK, start);
      List<RankedChunk> ranked =
          reranker.rerank(query, candidates, retrievalProperties.getTopK());

      stage = enter(PipelineStage.CONTEXT_ASSEMBLY, start);
      AssembledContext context = contextAssembler.assemble(ranked);
      if (!relevanceGate.isRelevant(query, context.chunks())) {
        long latencyMs = elapsed(start);
        log.info(
            "No relevant context for query '{}', returning no-information answer in {} ms",
            loggedQuery,
            latencyMs);
        return AnswerResponse.noInformation(latencyMs);
      }

      stage = enter(PipelineStage.CONTEXT_VALIDATION, start);
      String sanitizedContext = guardrailValidator.validateContext(context.text());

      stage = enter(PipelineStage.GENERATION, start);
      AnswerResponse generated =
          answerGenerator.generate(
              query, sanitizedContext, context.allowedPages(), context.allowedMedia());

      stage = enter(PipelineStage.OUTPUT_VALIDATION, start);
      guardrailValidator.validateOutput(generated, context.allowedPages(), context.allowedMedia());

      AnswerResponse response = generated.withLatencyMs(elapsed(start));
      log.info(
          "Answered query '{}' in {} ms: {} candidates, {} chunks, {} links, {} images",
          loggedQuery,
          response.latencyMs(),
          candidates.size(),
          context.chunks().size(),
          response.links() == null ? 0 : response.links().size(),
          response.images().size());
      return response;
    } catch (GuardrailViolationException e) {
      log.warn("Query '{}' rejected at {}: {}", loggedQuery, stage, e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.error("Query '{}' failed at {}: {}", loggedQuery, stage, e.toString(), e);
      throw e;
    }
  }

  private PipelineStage enter(PipelineStage next, long start) {
    long elapsedMs = elapsed(start);
    if (elapsedMs > pipelineProperties.latencyBudgetMs()) {
      throw new PipelineTimeoutException(next, elapsedMs, pipelineProperties.latencyBudgetMs());
    }
    log.debug("Entering {} after {} ms", next, elapsedMs);
    return next;
  }

  private long elapsed(long start) {
    return Math.max(0, clock.millis() - start);
  }

  private static String prefix(@Nullable String query) {
    if (query == null) {
      return "";
    }
    return query.length() > LOGGED_QUERY_PREFIX ? query.substring(0, LOGGED_QUERY_PREFIX) : query;
  }
}
