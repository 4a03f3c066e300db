package dev.folio.search.fusion;

import java.util.List;

/**
 * Result of fusing one query across its adapters.
 *
 * @param results fused results, best first
 * @param contributingAdapters adapters that answered, in selection order
 * @param unavailableAdapters adapters that failed or timed out, in selection order
 */
public record FusionOutcome(
    List<FusedResult> results,
    List<String> contributingAdapters,
    List<String> unavailableAdapters) {

  public FusionOutcome {
    results = List.copyOf(results);
    contributingAdapters = List.copyOf(contributingAdapters);
    unavailableAdapters = List.copyOf(unavailableAdapters);
  }
}
