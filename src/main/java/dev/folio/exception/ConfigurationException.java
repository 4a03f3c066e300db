package dev.folio.exception;

/**
 * Invalid engine configuration: embedding dimension mismatch, unknown aggregation strategy or
 * metric, out-of-range RRF constant, weights or decay. Fatal; raised at startup where possible.
 */
public class ConfigurationException extends RetrievalException {

  public ConfigurationException(String message) {
    super(message);
  }
}
