package dev.folio.search.fusion;

import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.ScoredResult;
import java.util.List;
import java.util.Map;

/**
 * A chunk after Reciprocal Rank Fusion.
 *
 * @param chunkId the chunk
 * @param fusedScore sum of {@code 1 / (kRrf + rank)} over every list containing the chunk
 * @param contributingLists ids of the lists that contained the chunk, in input order
 * @param bestRawScores per adapter kind, the raw score of the entry with the best normalised score
 * @param provenance every hit that contributed, in input order
 */
public record FusedResult(
    String chunkId,
    double fusedScore,
    List<String> contributingLists,
    Map<AdapterKind, Double> bestRawScores,
    List<ScoredResult> provenance) {

  public FusedResult {
    contributingLists = List.copyOf(contributingLists);
    bestRawScores = Map.copyOf(bestRawScores);
    provenance = List.copyOf(provenance);
  }
}
