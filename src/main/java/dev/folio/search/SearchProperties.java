package dev.folio.search;

import dev.folio.exception.ConfigurationException;
import dev.folio.search.decompose.AggregationStrategy;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code folio.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code rrf-k} - RRF smoothing constant (default 60, must be positive)
 *   <li>{@code rerank-candidates} - candidates fetched per adapter and offered to the reranker
 *       when reranking (default 30, bounded [10, 100])
 *   <li>{@code fetch-multiplier} - per-adapter over-fetch factor relative to the result limit
 *       (default 3)
 *   <li>{@code max-concurrency} - size of the retrieval thread pool (default 8)
 *   <li>{@code query-timeout} - deadline for all I/O of one query (default 5s)
 *   <li>{@code aggregation} - default sub-query aggregation: max, sum or weighted (default max)
 *   <li>{@code weighted-decay} - decay per sub-query for weighted aggregation (default 0.5, in
 *       (0, 1])
 *   <li>{@code max-sub-queries} - cap on decomposition output (default 5)
 *   <li>{@code lexical-score-ceiling} - BM25 score treated as a perfect match (default 10.0)
 *   <li>{@code semantic-weight} - weight of the semantic score in the combined score (default
 *       0.7, in [0, 1])
 *   <li>{@code keyword-weight} - weight of the lexical score in the combined score (default 0.3,
 *       in [0, 1])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "folio.search")
public class SearchProperties {

  private int rrfK = 60;
  private int rerankCandidates = 30;
  private int fetchMultiplier = 3;
  private int maxConcurrency = 8;
  private Duration queryTimeout = Duration.ofSeconds(5);
  private String aggregation = "max";
  private double weightedDecay = 0.5;
  private int maxSubQueries = 5;
  private double lexicalScoreCeiling = 10.0;
  private double semanticWeight = 0.7;
  private double keywordWeight = 0.3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (rrfK <= 0) {
      throw new ConfigurationException("folio.search.rrf-k must be positive, got: " + rrfK);
    }
    if (rerankCandidates < 10 || rerankCandidates > 100) {
      throw new ConfigurationException(
          "folio.search.rerank-candidates must be in [10, 100], got: " + rerankCandidates);
    }
    if (fetchMultiplier < 1) {
      throw new ConfigurationException(
          "folio.search.fetch-multiplier must be at least 1, got: " + fetchMultiplier);
    }
    if (maxConcurrency < 1) {
      throw new ConfigurationException(
          "folio.search.max-concurrency must be at least 1, got: " + maxConcurrency);
    }
    if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
      throw new ConfigurationException(
          "folio.search.query-timeout must be positive, got: " + queryTimeout);
    }
    AggregationStrategy.fromValue(aggregation);
    if (!(weightedDecay > 0.0 && weightedDecay <= 1.0)) {
      throw new ConfigurationException(
          "folio.search.weighted-decay must be in (0, 1], got: " + weightedDecay);
    }
    if (maxSubQueries < 1) {
      throw new ConfigurationException(
          "folio.search.max-sub-queries must be at least 1, got: " + maxSubQueries);
    }
    if (!(lexicalScoreCeiling > 0.0) || Double.isInfinite(lexicalScoreCeiling)) {
      throw new ConfigurationException(
          "folio.search.lexical-score-ceiling must be positive, got: " + lexicalScoreCeiling);
    }
    if (!(semanticWeight >= 0.0 && semanticWeight <= 1.0)) {
      throw new ConfigurationException(
          "folio.search.semantic-weight must be in [0, 1], got: " + semanticWeight);
    }
    if (!(keywordWeight >= 0.0 && keywordWeight <= 1.0)) {
      throw new ConfigurationException(
          "folio.search.keyword-weight must be in [0, 1], got: " + keywordWeight);
    }
  }

  public AggregationStrategy aggregationStrategy() {
    return AggregationStrategy.fromValue(aggregation);
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public int getRerankCandidates() {
    return rerankCandidates;
  }

  public void setRerankCandidates(int rerankCandidates) {
    this.rerankCandidates = rerankCandidates;
  }

  public int getFetchMultiplier() {
    return fetchMultiplier;
  }

  public void setFetchMultiplier(int fetchMultiplier) {
    this.fetchMultiplier = fetchMultiplier;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  public String getAggregation() {
    return aggregation;
  }

  public void setAggregation(String aggregation) {
    this.aggregation = aggregation;
  }

  public double getWeightedDecay() {
    return weightedDecay;
  }

  public void setWeightedDecay(double weightedDecay) {
    this.weightedDecay = weightedDecay;
  }

  public int getMaxSubQueries() {
    return maxSubQueries;
  }

  public void setMaxSubQueries(int maxSubQueries) {
    this.maxSubQueries = maxSubQueries;
  }

  public double getLexicalScoreCeiling() {
    return lexicalScoreCeiling;
  }

  public void setLexicalScoreCeiling(double lexicalScoreCeiling) {
    this.lexicalScoreCeiling = lexicalScoreCeiling;
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public double getKeywordWeight() {
    return keywordWeight;
  }

  public void setKeywordWeight(double keywordWeight) {
    this.keywordWeight = keywordWeight;
  }
}
