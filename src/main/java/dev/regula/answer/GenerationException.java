package dev.regula.answer;

/**
 * Answer generation failed: the provider call exhausted its retries, the output was not JSON, or
 * the parsed answer is structurally invalid.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
