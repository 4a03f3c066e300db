package dev.folio.exception;

/**
 * Signals that a single retrieval adapter could not serve a query (connection refused, I/O error,
 * timeout). Recoverable: the fusion engine excludes the adapter and continues with the rest.
 */
public class BackendUnavailableException extends RetrievalException {

  private final String adapterName;

  public BackendUnavailableException(String adapterName, String message) {
    super(adapterName + ": " + message);
    this.adapterName = adapterName;
  }

  public BackendUnavailableException(String adapterName, String message, Throwable cause) {
    super(adapterName + ": " + message, cause);
    this.adapterName = adapterName;
  }

  public String getAdapterName() {
    return adapterName;
  }
}
