package dev.folio.search.decompose;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.folio.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AggregationStrategyTest {

  @Test
  void parsesNamesCaseInsensitively() {
    assertThat(AggregationStrategy.fromValue("max")).isEqualTo(AggregationStrategy.MAX);
    assertThat(AggregationStrategy.fromValue(" SUM ")).isEqualTo(AggregationStrategy.SUM);
    assertThat(AggregationStrategy.fromValue("Weighted")).isEqualTo(AggregationStrategy.WEIGHTED);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "mean", "rrf"})
  void rejectsUnknownNames(String value) {
    assertThatThrownBy(() -> AggregationStrategy.fromValue(value))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("aggregation strategy");
  }

  @Test
  void rejectsNull() {
    assertThatThrownBy(() -> AggregationStrategy.fromValue(null))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void subQueryWeightMustBePositiveAndFinite() {
    assertThatThrownBy(() -> new SubQuery("q", 0.0, SubQueryOrigin.RULE))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new SubQuery("q", Double.POSITIVE_INFINITY, SubQueryOrigin.RULE))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new SubQuery("q", Double.NaN, SubQueryOrigin.RULE))
        .isInstanceOf(ConfigurationException.class);
  }
}
