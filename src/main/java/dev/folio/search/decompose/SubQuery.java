package dev.folio.search.decompose;

import dev.folio.exception.ConfigurationException;

/**
 * One part of a decomposed query.
 *
 * @param text the sub-query text
 * @param weight positive, finite multiplier applied to this sub-query's fused scores
 * @param origin the decomposer that produced it
 */
public record SubQuery(String text, double weight, SubQueryOrigin origin) {

  public static final double DEFAULT_WEIGHT = 1.0;

  public SubQuery {
    if (text == null) {
      throw new IllegalArgumentException("Sub-query text must not be null");
    }
    if (!(weight > 0.0) || Double.isInfinite(weight)) {
      throw new ConfigurationException(
          "Sub-query weight must be positive and finite, got " + weight);
    }
  }

  public static SubQuery of(String text, SubQueryOrigin origin) {
    return new SubQuery(text, DEFAULT_WEIGHT, origin);
  }
}
