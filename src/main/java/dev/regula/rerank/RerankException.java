package dev.regula.rerank;

/**
 * The reranking model call failed, its response could not be parsed, or the scored ids do not
 * match the candidates sent. Not retried.
 */
public class RerankException extends RuntimeException {

  public RerankException(String message) {
    super(message);
  }

  public RerankException(String message, Throwable cause) {
    super(message, cause);
  }
}
