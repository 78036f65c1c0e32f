package dev.regula.llm;

/** Model output could not be read as JSON, neither directly nor from its outermost braces. */
public class JsonExtractionException extends RuntimeException {

  public JsonExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
