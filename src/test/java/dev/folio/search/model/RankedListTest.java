package dev.folio.search.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RankedListTest {

  private static final ResultSource SOURCE = new ResultSource("vec", AdapterKind.SEMANTIC, null);

  private static ScoredResult hit(String id, int rank) {
    return new ScoredResult(id, 0.5, 0.5, rank, SOURCE);
  }

  @Test
  void acceptsDenseRanks() {
    RankedList list =
        new RankedList("vec", AdapterKind.SEMANTIC, List.of(hit("a", 1), hit("b", 2)));

    assertThat(list.size()).isEqualTo(2);
    assertThat(list.isEmpty()).isFalse();
  }

  @Test
  void rejectsRankGap() {
    assertThatThrownBy(
            () -> new RankedList("vec", AdapterKind.SEMANTIC, List.of(hit("a", 1), hit("b", 3))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expected rank 2");
  }

  @Test
  void rejectsDuplicateChunk() {
    assertThatThrownBy(
            () -> new RankedList("vec", AdapterKind.SEMANTIC, List.of(hit("a", 1), hit("a", 2))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("duplicate");
  }

  @Test
  void emptyListIsValid() {
    assertThat(RankedList.empty("vec", AdapterKind.SEMANTIC).isEmpty()).isTrue();
  }

  @Test
  void scoredResultRejectsOutOfRangeNormalisedScore() {
    assertThatThrownBy(() -> new ScoredResult("a", 3.0, 1.5, 1, SOURCE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ScoredResult("a", 3.0, Double.NaN, 1, SOURCE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void retrievalQueryRejectsNonPositiveK() {
    assertThatThrownBy(() -> new RetrievalQuery("q", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
