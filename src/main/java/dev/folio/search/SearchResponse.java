package dev.folio.search;

import dev.folio.search.decompose.SubQuery;
import java.util.List;

/**
 * Outcome of a search.
 *
 * @param results the ranked hits
 * @param subQueries the sub-queries that were retrieved (the whole query when not decomposed)
 * @param unavailableAdapters adapters that failed or timed out for at least one sub-query
 * @param reranked whether the cross-encoder ordered the results
 */
public record SearchResponse(
    List<SearchResult> results,
    List<SubQuery> subQueries,
    List<String> unavailableAdapters,
    boolean reranked) {

  public SearchResponse {
    results = List.copyOf(results);
    subQueries = List.copyOf(subQueries);
    unavailableAdapters = List.copyOf(unavailableAdapters);
  }
}
