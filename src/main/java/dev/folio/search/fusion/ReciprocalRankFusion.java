package dev.folio.search.fusion;

import dev.folio.exception.ConfigurationException;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.ScoredResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility merging ranked lists with Reciprocal Rank Fusion.
 *
 * <p>{@code fusedScore(c) = sum over lists L containing c of 1 / (kRrf + rank_L(c))}. Only ranks
 * matter, so lists from backends with incomparable score scales fuse without calibration.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class ReciprocalRankFusion {

  /** Smoothing constant from Cormack et al. (2009). */
  public static final int DEFAULT_K = 60;

  private ReciprocalRankFusion() {}

  /**
   * Fuses ranked lists.
   *
   * @param lists the per-adapter lists, any of which may be empty
   * @param kRrf the smoothing constant, must be positive
   * @return fused results by score descending, ties by chunk id ascending
   * @throws ConfigurationException if {@code kRrf <= 0}
   */
  public static List<FusedResult> fuse(List<RankedList> lists, int kRrf) {
    requireValidK(kRrf);

    Map<String, Accumulator> byChunk = new LinkedHashMap<>();
    for (RankedList list : lists) {
      for (ScoredResult result : list.results()) {
        byChunk
            .computeIfAbsent(result.chunkId(), Accumulator::new)
            .add(list.listId(), result, 1.0 / ((double) kRrf + result.rank()));
      }
    }

    return byChunk.values().stream()
        .map(Accumulator::toFusedResult)
        .sorted(
            Comparator.comparingDouble(FusedResult::fusedScore)
                .reversed()
                .thenComparing(FusedResult::chunkId))
        .toList();
  }

  /**
   * @throws ConfigurationException if {@code kRrf <= 0}
   */
  public static void requireValidK(int kRrf) {
    if (kRrf <= 0) {
      throw new ConfigurationException("RRF constant k must be positive, got " + kRrf);
    }
  }

  private static final class Accumulator {

    private final String chunkId;
    private double score;
    private final List<String> lists = new ArrayList<>();
    private final List<ScoredResult> provenance = new ArrayList<>();
    private final Map<AdapterKind, ScoredResult> bestByKind = new EnumMap<>(AdapterKind.class);

    Accumulator(String chunkId) {
      this.chunkId = chunkId;
    }

    void add(String listId, ScoredResult result, double contribution) {
      score += contribution;
      if (!lists.contains(listId)) {
        lists.add(listId);
      }
      provenance.add(result);
      bestByKind.merge(
          result.source().adapterKind(),
          result,
          (current, candidate) ->
              candidate.normalisedScore() > current.normalisedScore() ? candidate : current);
    }

    FusedResult toFusedResult() {
      Map<AdapterKind, Double> bestRaw = new HashMap<>();
      bestByKind.forEach((kind, result) -> bestRaw.put(kind, result.rawScore()));
      return new FusedResult(chunkId, score, lists, bestRaw, provenance);
    }
  }
}
