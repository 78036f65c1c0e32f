package dev.regula.llm;

/**
 * One chat completion: a system prompt, a user prompt and the sampling temperature.
 *
 * @param systemPrompt instructions and output schema
 * @param userPrompt the per-request payload
 * @param temperature sampling temperature, 0 for deterministic decoding
 */
public record CompletionRequest(String systemPrompt, String userPrompt, double temperature) {

  public CompletionRequest {
    if (systemPrompt == null || systemPrompt.isBlank()) {
      throw new IllegalArgumentException("systemPrompt must not be blank");
    }
    if (userPrompt == null || userPrompt.isBlank()) {
      throw new IllegalArgumentException("userPrompt must not be blank");
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalArgumentException("temperature must be in [0.0, 2.0], got: " + temperature);
    }
  }
}
