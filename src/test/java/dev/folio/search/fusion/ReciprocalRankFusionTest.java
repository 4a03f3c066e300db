package dev.folio.search.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.folio.exception.ConfigurationException;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.ResultSource;
import dev.folio.search.model.ScoredResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

  // --- Helper factory methods ---

  static RankedList list(String listId, AdapterKind kind, String... ids) {
    List<ScoredResult> results = new ArrayList<>();
    for (int i = 0; i < ids.length; i++) {
      double normalised = 1.0 - i * 0.1;
      results.add(
          new ScoredResult(
              ids[i], normalised * 2, normalised, i + 1, new ResultSource(listId, kind, null)));
    }
    return new RankedList(listId, kind, results);
  }

  private static List<String> ids(List<FusedResult> fused) {
    return fused.stream().map(FusedResult::chunkId).toList();
  }

  // --- Test cases ---

  @Test
  void semanticAndLexicalListsFuseInRrfOrder() {
    RankedList semantic = list("vec", AdapterKind.SEMANTIC, "A", "B", "C");
    RankedList lexical = list("bm25", AdapterKind.LEXICAL, "B", "D", "A");

    List<FusedResult> fused = ReciprocalRankFusion.fuse(List.of(semantic, lexical), 60);

    assertThat(ids(fused)).containsExactly("B", "A", "D", "C");
    assertThat(fused.get(0).fusedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
    assertThat(fused.get(1).fusedScore()).isCloseTo(1.0 / 61 + 1.0 / 63, within(1e-12));
    assertThat(fused.get(2).fusedScore()).isCloseTo(1.0 / 62, within(1e-12));
    assertThat(fused.get(3).fusedScore()).isCloseTo(1.0 / 63, within(1e-12));
  }

  @Test
  void recordsContributingListsAndProvenance() {
    RankedList semantic = list("vec", AdapterKind.SEMANTIC, "A", "B");
    RankedList lexical = list("bm25", AdapterKind.LEXICAL, "B");

    FusedResult b = ReciprocalRankFusion.fuse(List.of(semantic, lexical), 60).get(0);

    assertThat(b.chunkId()).isEqualTo("B");
    assertThat(b.contributingLists()).containsExactly("vec", "bm25");
    assertThat(b.provenance()).hasSize(2);
    assertThat(b.bestRawScores())
        .containsEntry(AdapterKind.SEMANTIC, 1.8)
        .containsEntry(AdapterKind.LEXICAL, 2.0);
  }

  @Test
  void bestRawScoreFollowsBestNormalisedScorePerKind() {
    ResultSource first = new ResultSource("vec-1", AdapterKind.SEMANTIC, null);
    ResultSource second = new ResultSource("vec-2", AdapterKind.SEMANTIC, null);
    RankedList l1 =
        new RankedList(
            "vec-1", AdapterKind.SEMANTIC, List.of(new ScoredResult("A", 0.2, 0.6, 1, first)));
    RankedList l2 =
        new RankedList(
            "vec-2", AdapterKind.SEMANTIC, List.of(new ScoredResult("A", 0.9, 0.95, 1, second)));

    FusedResult a = ReciprocalRankFusion.fuse(List.of(l1, l2), 60).get(0);

    assertThat(a.bestRawScores()).containsExactly(Map.entry(AdapterKind.SEMANTIC, 0.9));
  }

  @Test
  void singleListPassesThroughInRankOrder() {
    RankedList only = list("vec", AdapterKind.SEMANTIC, "C", "A", "B");

    assertThat(ids(ReciprocalRankFusion.fuse(List.of(only), 60))).containsExactly("C", "A", "B");
  }

  @Test
  void emptyListsAreIgnored() {
    RankedList only = list("vec", AdapterKind.SEMANTIC, "A");

    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(RankedList.empty("bm25", AdapterKind.LEXICAL), only), 60);

    assertThat(ids(fused)).containsExactly("A");
    assertThat(ReciprocalRankFusion.fuse(List.of(), 60)).isEmpty();
  }

  @Test
  void tiesAreBrokenByChunkId() {
    RankedList first = list("vec", AdapterKind.SEMANTIC, "Z");
    RankedList second = list("bm25", AdapterKind.LEXICAL, "M");

    assertThat(ids(ReciprocalRankFusion.fuse(List.of(first, second), 60)))
        .containsExactly("M", "Z");
  }

  @Test
  void nonPositiveKIsConfigurationError() {
    assertThatThrownBy(() -> ReciprocalRankFusion.fuse(List.of(), 0))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> ReciprocalRankFusion.fuse(List.of(), -5))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void largestSmoothingConstantKeepsScoresPositiveAndOrdered() {
    List<FusedResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(
                list("vec", AdapterKind.SEMANTIC, "A", "C"),
                list("bm25", AdapterKind.LEXICAL, "A", "D")),
            Integer.MAX_VALUE);

    assertThat(ids(fused)).containsExactly("A", "C", "D");
    assertThat(fused).allSatisfy(r -> assertThat(r.fusedScore()).isPositive());
    assertThat(fused.get(0).fusedScore()).isGreaterThan(fused.get(1).fusedScore());
  }
}
