package dev.folio.search.model;

/**
 * A single hit from one adapter, carrying both the backend-native score and its canonical
 * normalisation.
 *
 * @param chunkId the matched chunk
 * @param rawScore the backend-native similarity, distance or BM25 score
 * @param normalisedScore the comparable relevance score in [0, 1]
 * @param rank 1-based position within the originating ranked list
 * @param source the adapter and sub-query that produced the hit
 */
public record ScoredResult(
    String chunkId, double rawScore, double normalisedScore, int rank, ResultSource source) {

  public ScoredResult {
    if (normalisedScore < 0.0 || normalisedScore > 1.0 || Double.isNaN(normalisedScore)) {
      throw new IllegalArgumentException(
          "normalisedScore must be in [0, 1], got " + normalisedScore + " for " + chunkId);
    }
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be at least 1, got " + rank);
    }
  }
}
