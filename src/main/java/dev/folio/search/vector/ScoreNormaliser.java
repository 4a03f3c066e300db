package dev.folio.search.vector;

import java.util.List;

/**
 * Pure static mapping from backend-native scores to a canonical relevance in [0, 1], so results
 * from different backends are comparable.
 *
 * <ul>
 *   <li>{@link VectorMetric#COSINE}: {@code (s + 1) / 2}
 *   <li>{@link VectorMetric#L2}: {@code 1 / (1 + d)}
 *   <li>{@link VectorMetric#DOT}: min-max against the batch of the same query; a batch with a
 *       single distinct value maps to 1.0
 *   <li>{@link VectorMetric#UNKNOWN_RANGE}: identity when the whole batch already lies in [0, 1],
 *       otherwise the same min-max as DOT
 * </ul>
 *
 * <p>Results depend only on {@code (rawScore, metric, batch)}, never on call order. NaN maps to
 * 0.0.
 */
public final class ScoreNormaliser {

  private ScoreNormaliser() {}

  /**
   * Observed range of the raw scores returned for one query by one backend.
   *
   * @param min smallest raw score
   * @param max largest raw score
   * @param size number of scores in the batch
   */
  public record BatchContext(double min, double max, int size) {

    public static final BatchContext EMPTY = new BatchContext(0.0, 0.0, 0);

    public static BatchContext of(List<Double> rawScores) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      int size = 0;
      for (double score : rawScores) {
        if (Double.isNaN(score)) {
          continue;
        }
        min = Math.min(min, score);
        max = Math.max(max, score);
        size++;
      }
      return size == 0 ? EMPTY : new BatchContext(min, max, size);
    }

    boolean withinUnitInterval() {
      return size > 0 && min >= 0.0 && max <= 1.0;
    }
  }

  /**
   * Normalises one raw score.
   *
   * @param rawScore the backend-native value
   * @param metric the backend's native metric
   * @param batch the range observed in the same query's batch
   * @return relevance in [0, 1], higher is better
   */
  public static double normalise(double rawScore, VectorMetric metric, BatchContext batch) {
    if (Double.isNaN(rawScore)) {
      return 0.0;
    }
    double score =
        switch (metric) {
          case COSINE -> (rawScore + 1.0) / 2.0;
          case L2 -> 1.0 / (1.0 + Math.max(0.0, rawScore));
          case DOT -> minMax(rawScore, batch);
          case UNKNOWN_RANGE -> batch.withinUnitInterval() ? rawScore : minMax(rawScore, batch);
        };
    return clamp(score);
  }

  /** Normalises a whole batch, computing its {@link BatchContext} first. */
  public static List<Double> normaliseAll(List<Double> rawScores, VectorMetric metric) {
    BatchContext batch = BatchContext.of(rawScores);
    return rawScores.stream().map(raw -> normalise(raw, metric, batch)).toList();
  }

  /**
   * Maps a non-negative lexical (BM25) score to [0, 1] by saturating at {@code ceiling}.
   *
   * @param rawScore the BM25 score
   * @param ceiling the raw score treated as a perfect match
   * @return {@code min(1, rawScore / ceiling)}, 0.0 for non-positive or NaN scores
   */
  public static double saturate(double rawScore, double ceiling) {
    if (Double.isNaN(rawScore) || rawScore <= 0.0) {
      return 0.0;
    }
    return clamp(rawScore / ceiling);
  }

  private static double minMax(double rawScore, BatchContext batch) {
    if (batch.size() <= 1 || batch.max() == batch.min()) {
      return 1.0;
    }
    return (rawScore - batch.min()) / (batch.max() - batch.min());
  }

  private static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }
}
