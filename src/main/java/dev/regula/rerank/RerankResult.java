package dev.regula.rerank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Reranking model response: {@code {"results":[{"id":0,"score":0.9}, ...]}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RerankResult(List<RerankScore> results) {

  public RerankResult {
    results = results == null ? List.of() : List.copyOf(results);
  }
}
