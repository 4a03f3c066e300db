package dev.folio.search.decompose;

import dev.folio.search.model.ScoredResult;
import java.util.List;

/**
 * A chunk after merging the fused lists of all sub-queries.
 *
 * @param chunkId the chunk
 * @param aggregateScore the combined score
 * @param matchedSubQueries indices of the sub-queries whose fused list contained the chunk,
 *     ascending
 * @param provenance every adapter hit behind the chunk, across sub-queries
 */
public record AggregatedResult(
    String chunkId,
    double aggregateScore,
    List<Integer> matchedSubQueries,
    List<ScoredResult> provenance) {

  public AggregatedResult {
    matchedSubQueries = List.copyOf(matchedSubQueries);
    provenance = List.copyOf(provenance);
  }
}
