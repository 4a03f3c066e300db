package dev.folio.exception;

import java.util.List;

/** Raised when every adapter selected for a query failed, so nothing can be searched. */
public class NoSearchableBackendException extends RetrievalException {

  private final List<String> triedAdapters;

  public NoSearchableBackendException(List<String> triedAdapters) {
    super(
        triedAdapters.isEmpty()
            ? "No retrieval adapter is configured for this search mode"
            : "All retrieval adapters are unavailable: " + String.join(", ", triedAdapters));
    this.triedAdapters = List.copyOf(triedAdapters);
  }

  public List<String> getTriedAdapters() {
    return triedAdapters;
  }

  public String getUserMessage() {
    return triedAdapters.isEmpty()
        ? "Search is not configured for this mode."
        : "Search is temporarily unavailable. Please try again.";
  }
}
