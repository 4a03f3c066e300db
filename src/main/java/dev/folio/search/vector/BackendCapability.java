package dev.folio.search.vector;

/**
 * Declares how a backend scores and what it can do natively. Consumed by {@link ScoreNormaliser}
 * to select a mapping and by {@link VectorStoreAdapter} to decide whether filters need to be
 * applied after the fact.
 *
 * @param metric native metric of the raw scores
 * @param supportsMetadataFiltering whether the backend evaluates metadata filters itself
 */
public record BackendCapability(VectorMetric metric, boolean supportsMetadataFiltering) {

  public BackendCapability {
    if (metric == null) {
      throw new IllegalArgumentException("metric must not be null");
    }
  }
}
