package dev.folio.search;

import dev.folio.search.decompose.AggregationStrategy;
import dev.langchain4j.store.embedding.filter.Filter;
import org.jspecify.annotations.Nullable;

/**
 * Domain request DTO for search queries.
 *
 * @param query the search query text (must not be null or blank)
 * @param mode which adapters to consult (null means {@link SearchMode#HYBRID})
 * @param decompose split the query into sub-queries before retrieval
 * @param rerank reorder the final candidates with the cross-encoder
 * @param limit the maximum number of results to return (must be >= 1)
 * @param filter optional metadata filter, applied by every adapter
 * @param aggregation optional sub-query aggregation strategy (null means the configured default)
 * @param minScore optional relevance threshold: applied to the rerank score when the reranker ran,
 *     otherwise a result is dropped when both its combined and its fused score fall below it
 * @param rrfK optional RRF constant overriding the configured one
 * @param semanticWeight optional weight of the semantic score in the combined score
 * @param keywordWeight optional weight of the lexical score in the combined score
 */
public record SearchRequest(
    String query,
    SearchMode mode,
    boolean decompose,
    boolean rerank,
    int limit,
    @Nullable Filter filter,
    @Nullable AggregationStrategy aggregation,
    @Nullable Double minScore,
    @Nullable Integer rrfK,
    @Nullable Double semanticWeight,
    @Nullable Double keywordWeight) {

  /** Default number of results when not specified. */
  private static final int DEFAULT_LIMIT = 10;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    if (mode == null) {
      mode = SearchMode.HYBRID;
    }
    requireValidWeight("semanticWeight", semanticWeight);
    requireValidWeight("keywordWeight", keywordWeight);
  }

  /** Request with the configured combined-score weights. */
  public SearchRequest(
      String query,
      SearchMode mode,
      boolean decompose,
      boolean rerank,
      int limit,
      @Nullable Filter filter,
      @Nullable AggregationStrategy aggregation,
      @Nullable Double minScore,
      @Nullable Integer rrfK) {
    this(
        query, mode, decompose, rerank, limit, filter, aggregation, minScore, rrfK, null, null);
  }

  /** Convenience constructor: hybrid, no decomposition or reranking, 10 results. */
  public SearchRequest(String query) {
    this(query, DEFAULT_LIMIT);
  }

  /** Convenience constructor: hybrid, no decomposition or reranking. */
  public SearchRequest(String query, int limit) {
    this(query, SearchMode.HYBRID, false, false, limit, null, null, null, null);
  }

  private static void requireValidWeight(String name, @Nullable Double weight) {
    if (weight != null && !(weight >= 0.0 && weight <= 1.0)) {
      throw new IllegalArgumentException(name + " must be in [0, 1], got " + weight);
    }
  }
}
