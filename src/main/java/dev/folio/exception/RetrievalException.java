package dev.folio.exception;

/** Base type for failures raised by the retrieval and ranking engine. */
public class RetrievalException extends RuntimeException {

  public RetrievalException(String message) {
    super(message);
  }

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
