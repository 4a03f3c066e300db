package dev.folio.search.decompose;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.folio.exception.ConfigurationException;
import java.util.Locale;

/** How fused scores of several sub-queries combine into one score per chunk. */
public enum AggregationStrategy {
  /** Best weighted score across sub-queries. */
  MAX("max"),
  /** Sum of weighted scores. */
  SUM("sum"),
  /** Sum with weights decayed geometrically by decomposition order. */
  WEIGHTED("weighted");

  private final String value;

  AggregationStrategy(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses a strategy name case-insensitively.
   *
   * @throws ConfigurationException for unknown names
   */
  @JsonCreator
  public static AggregationStrategy fromValue(String value) {
    if (value != null) {
      String normalised = value.strip().toLowerCase(Locale.ROOT);
      for (AggregationStrategy strategy : values()) {
        if (strategy.value.equals(normalised)) {
          return strategy;
        }
      }
    }
    throw new ConfigurationException("Unknown aggregation strategy: " + value);
  }
}
