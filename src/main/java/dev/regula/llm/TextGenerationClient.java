package dev.regula.llm;

/**
 * Text-generation provider used by the reranker and the answer generator.
 *
 * <p>Implementations apply the configured connection/response timeout and retry transient
 * failures; a {@link TextGenerationException} escaping {@link #complete} means retries are
 * exhausted.
 */
public interface TextGenerationClient {

  /**
   * Runs one completion and returns the raw model text.
   *
   * @param request prompts and temperature
   * @return the model output, never blank
   * @throws TextGenerationException if the provider call failed after all retries
   */
  String complete(CompletionRequest request);
}
