package dev.regula.rerank;

import dev.regula.llm.CompletionRequest;
import dev.regula.llm.JsonExtractionException;
import dev.regula.llm.LenientJsonParser;
import dev.regula.llm.LlmProperties;
import dev.regula.llm.TextGenerationClient;
import dev.regula.llm.TextGenerationException;
import dev.regula.search.CandidateResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Second-stage relevance scoring with a text-generation model.
 *
 * <p>All candidates are scored in one provider call: the prompt lists each candidate text
 * (truncated to {@code regula.rerank.max-passage-chars}) under its 0-based index and asks for
 * {@code {"results":[{"id":int,"score":float}]}}. The response must cover every index exactly once.
 * Scores outside [0, 1] are clamped rather than rejected.
 *
 * <p>Provider failures are retried by the {@link TextGenerationClient}; an unparsable response is
 * not retried. Both surface as {@link RerankException}.
 */
@Service
public class LlmReranker {

  private static final Logger log = LoggerFactory.getLogger(LlmReranker.class);

  private final TextGenerationClient textGenerationClient;
  private final LenientJsonParser jsonParser;
  private final RerankProperties rerankProperties;
  private final double temperature;

  public LlmReranker(
      TextGenerationClient textGenerationClient,
      LenientJsonParser jsonParser,
      RerankProperties rerankProperties,
      LlmProperties llmProperties) {
    this.textGenerationClient = textGenerationClient;
    this.jsonParser = jsonParser;
    this.rerankProperties = rerankProperties;
    this.temperature = llmProperties.temperature();
  }

  /**
   * Scores every candidate.
   *
   * @param query the sanitized query
   * @param candidates candidates in retrieval order; their positions are the ids sent to the model
   * @return one score per candidate, indexed by position in {@code candidates}
   * @throws RerankException if the call fails, the response is unparsable, or ids do not cover the
   *     candidate range exactly
   */
  public List<RerankScore> score(String query, List<CandidateResult> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<String> passages = candidates.stream().map(c -> c.chunk().text()).toList();
    CompletionRequest request =
        new CompletionRequest(
            RerankPrompts.SYSTEM_PROMPT,
            RerankPrompts.userPrompt(query, passages, rerankProperties.maxPassageChars()),
            temperature);

    String raw;
    try {
      raw = textGenerationClient.complete(request);
    } catch (TextGenerationException e) {
      throw new RerankException("Reranking call failed: " + e.getMessage(), e);
    }

    RerankResult result;
    try {
      result = jsonParser.parse(raw, RerankResult.class);
    } catch (JsonExtractionException e) {
      log.error("Failed to parse reranker response: {}", abbreviate(raw));
      throw new RerankException("Reranker response is not valid JSON", e);
    }

    return indexScores(result, candidates.size());
  }

  /**
   * Scores the candidates, sorts them by score descending and keeps the best {@code topK}. Equal
   * scores keep retrieval order.
   *
   * @param query the sanitized query
   * @param candidates candidates in retrieval order
   * @param topK maximum number of chunks to keep
   * @return at most {@code min(topK, candidates.size())} ranked chunks
   * @throws RerankException as for {@link #score}
   */
  public List<RankedChunk> rerank(String query, List<CandidateResult> candidates, int topK) {
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be >= 1, got: " + topK);
    }
    List<RerankScore> scores = score(query, candidates);

    List<RankedChunk> ranked = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      CandidateResult candidate = candidates.get(i);
      ranked.add(new RankedChunk(candidate.chunk(), candidate.score(), scores.get(i).score()));
    }
    // List.sort is stable
    ranked.sort(Comparator.comparingDouble(RankedChunk::rerankScore).reversed());
    List<RankedChunk> top = ranked.subList(0, Math.min(topK, ranked.size()));

    if (log.isDebugEnabled() && !top.isEmpty()) {
      log.debug(
          "Reranked {} candidates, kept {}, top score {}",
          candidates.size(),
          top.size(),
          String.format("%.3f", top.get(0).rerankScore()));
    }
    return List.copyOf(top);
  }

  private List<RerankScore> indexScores(RerankResult result, int candidateCount) {
    RerankScore[] byIndex = new RerankScore[candidateCount];
    for (RerankScore entry : result.results()) {
      Integer id = entry.candidateIndex();
      if (id == null || entry.score() == null) {
        throw new RerankException("Reranker result is missing an id or score: " + entry);
      }
      if (id < 0 || id >= candidateCount) {
        throw new RerankException(
            "Reranker returned id " + id + " outside candidate range [0, " + candidateCount + ")");
      }
      if (byIndex[id] != null) {
        throw new RerankException("Reranker returned id " + id + " more than once");
      }
      double score = entry.score();
      if (Double.isNaN(score)) {
        throw new RerankException("Reranker returned a non-numeric score for id " + id);
      }
      byIndex[id] = new RerankScore(id, Math.max(0.0, Math.min(1.0, score)));
    }

    for (int i = 0; i < candidateCount; i++) {
      if (byIndex[i] == null) {
        throw new RerankException("Reranker omitted candidate id " + i);
      }
    }
    return List.of(byIndex);
  }

  private static String abbreviate(String raw) {
    return raw.length() > 500 ? raw.substring(0, 500) + "..." : raw;
  }
}
