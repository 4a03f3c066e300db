package dev.folio.search.vector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.folio.exception.ConfigurationException;

/** Native score semantics reported by a vector backend. */
public enum VectorMetric {
  /** Cosine similarity in [-1, 1], higher is better. */
  COSINE("cosine"),
  /** Euclidean distance in [0, inf), lower is better. */
  L2("l2"),
  /** Unbounded inner product, higher is better. */
  DOT("dot"),
  /** Higher is better, but no range is promised. */
  UNKNOWN_RANGE("unknown_range");

  private final String value;

  VectorMetric(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True when a smaller raw value means a closer match. */
  public boolean isDistance() {
    return this == L2;
  }

  @JsonCreator
  public static VectorMetric fromValue(String value) {
    for (VectorMetric metric : values()) {
      if (metric.value.equalsIgnoreCase(value) || metric.name().equalsIgnoreCase(value)) {
        return metric;
      }
    }
    throw new ConfigurationException("Unknown vector metric: " + value);
  }
}
