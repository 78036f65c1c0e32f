package dev.regula.llm;

/** Transient text-generation failure: timeout, transport error, or an empty completion. */
public class TextGenerationException extends RuntimeException {

  public TextGenerationException(String message) {
    super(message);
  }

  public TextGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
