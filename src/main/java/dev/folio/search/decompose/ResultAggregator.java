package dev.folio.search.decompose;

import dev.folio.exception.ConfigurationException;
import dev.folio.search.fusion.FusedResult;
import dev.folio.search.model.ScoredResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility merging per-sub-query fused lists into one list.
 *
 * <p>With {@code w_i} the weight of sub-query {@code i} and {@code f_i(c)} the fused score of chunk
 * {@code c} for it:
 *
 * <ul>
 *   <li>MAX: {@code max_i w_i * f_i(c)}
 *   <li>SUM: {@code sum_i w_i * f_i(c)}
 *   <li>WEIGHTED: {@code sum_i w_i * decay^i * f_i(c)}
 * </ul>
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class ResultAggregator {

  private ResultAggregator() {}

  /**
   * Aggregates fused lists.
   *
   * @param subQueries the sub-queries, in decomposition order
   * @param fusedPerSubQuery the fused list of each sub-query, same order; empty for a sub-query
   *     that found nothing or whose adapters all failed
   * @param strategy the aggregation strategy
   * @param decay geometric decay for {@link AggregationStrategy#WEIGHTED}, in (0, 1]
   * @return one entry per chunk, by aggregate score descending, ties by chunk id
   */
  public static List<AggregatedResult> aggregate(
      List<SubQuery> subQueries,
      List<List<FusedResult>> fusedPerSubQuery,
      AggregationStrategy strategy,
      double decay) {
    if (subQueries.size() != fusedPerSubQuery.size()) {
      throw new IllegalArgumentException(
          "Expected "
              + subQueries.size()
              + " fused lists but got "
              + fusedPerSubQuery.size());
    }
    requireValidDecay(decay);

    Map<String, Accumulator> byChunk = new LinkedHashMap<>();
    for (int i = 0; i < subQueries.size(); i++) {
      double weight = subQueries.get(i).weight();
      if (strategy == AggregationStrategy.WEIGHTED) {
        weight *= Math.pow(decay, i);
      }
      for (FusedResult fused : fusedPerSubQuery.get(i)) {
        byChunk
            .computeIfAbsent(fused.chunkId(), id -> new Accumulator(id, strategy))
            .add(i, weight * fused.fusedScore(), fused.provenance());
      }
    }

    return byChunk.values().stream()
        .map(Accumulator::toResult)
        .sorted(
            Comparator.comparingDouble(AggregatedResult::aggregateScore)
                .reversed()
                .thenComparing(AggregatedResult::chunkId))
        .toList();
  }

  /**
   * @throws ConfigurationException unless {@code 0 < decay <= 1}
   */
  public static void requireValidDecay(double decay) {
    if (!(decay > 0.0 && decay <= 1.0)) {
      throw new ConfigurationException("Weighted decay must be in (0, 1], got " + decay);
    }
  }

  private static final class Accumulator {

    private final String chunkId;
    private final AggregationStrategy strategy;
    private double score;
    private boolean first = true;
    private final List<Integer> subQueries = new ArrayList<>();
    private final List<ScoredResult> provenance = new ArrayList<>();

    Accumulator(String chunkId, AggregationStrategy strategy) {
      this.chunkId = chunkId;
      this.strategy = strategy;
    }

    void add(int subQueryIndex, double weightedScore, List<ScoredResult> hits) {
      if (strategy == AggregationStrategy.MAX) {
        score = first ? weightedScore : Math.max(score, weightedScore);
      } else {
        score += weightedScore;
      }
      first = false;
      if (!subQueries.contains(subQueryIndex)) {
        subQueries.add(subQueryIndex);
      }
      provenance.addAll(hits);
    }

    AggregatedResult toResult() {
      return new AggregatedResult(chunkId, score, subQueries, provenance);
    }
  }
}
