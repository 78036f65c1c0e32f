package dev.regula.rerank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Relevance score of one candidate, as returned by the reranking model.
 *
 * <p>Fields are nullable because they come straight from model output; {@link LlmReranker}
 * rejects entries with missing values.
 *
 * @param candidateIndex 0-based position of the candidate in the list sent to the model
 * @param score relevance in [0, 1]
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RerankScore(
    @JsonProperty("id") @Nullable Integer candidateIndex, @Nullable Double score) {}
