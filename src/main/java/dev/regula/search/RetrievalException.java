package dev.regula.search;

/**
 * Retrieval could not produce candidates: the query was empty, both indexes returned nothing, or
 * the retrieval infrastructure failed. Surfaced as a service failure and not retried.
 */
public class RetrievalException extends RuntimeException {

  public RetrievalException(String message) {
    super(message);
  }

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
