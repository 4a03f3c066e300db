package dev.folio.search.lexical;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import dev.folio.document.Chunk;
import dev.folio.document.ChunkCatalog;
import dev.folio.exception.BackendUnavailableException;
import dev.folio.exception.ConfigurationException;
import dev.folio.fixture.ChunkBuilder;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.ScoredResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexicalIndexAdapterTest {

  private final ChunkCatalog catalog = new ChunkCatalog();

  @Test
  void saturatesScoresAgainstCeiling() {
    LuceneBm25Index index = mock(LuceneBm25Index.class);
    given(index.name()).willReturn("bm25");
    given(index.search("q", 3))
        .willReturn(
            List.of(
                new LexicalHit("b", 5.0), new LexicalHit("a", 15.0), new LexicalHit("c", 5.0)));
    LexicalIndexAdapter adapter = new LexicalIndexAdapter(index, catalog, 10.0, 3);

    RankedList list = adapter.search("q", 3);

    assertThat(list.adapterKind()).isEqualTo(AdapterKind.LEXICAL);
    assertThat(list.results()).extracting(ScoredResult::chunkId).containsExactly("a", "b", "c");
    assertThat(list.results())
        .extracting(ScoredResult::normalisedScore)
        .containsExactly(1.0, 0.5, 0.5);
    assertThat(list.results().get(0).rawScore()).isEqualTo(15.0);
  }

  @Test
  void filtersAgainstCatalogAfterOverFetching() {
    LuceneBm25Index index = new LuceneBm25Index("bm25");
    LexicalIndexAdapter adapter = new LexicalIndexAdapter(index, catalog, 10.0, 3);
    List<Chunk> chunks =
        List.of(
            new ChunkBuilder().id("a").text("spring beans").metadata("lang", "en").build(),
            new ChunkBuilder().id("b").text("spring beans beans").metadata("lang", "fr").build());
    catalog.putAll(chunks);
    adapter.index(chunks);

    RankedList list = adapter.search("beans", 1, metadataKey("lang").isEqualTo("en"));

    assertThat(list.results()).extracting(ScoredResult::chunkId).containsExactly("a");
    adapter.close();
  }

  @Test
  void indexFailureIsBackendUnavailable() {
    LuceneBm25Index index = mock(LuceneBm25Index.class);
    given(index.search("q", 5)).willThrow(new BackendUnavailableException("bm25", "io"));
    LexicalIndexAdapter adapter = new LexicalIndexAdapter(index, catalog, 10.0, 3);

    assertThatThrownBy(() -> adapter.search("q", 5))
        .isInstanceOf(BackendUnavailableException.class);
  }

  @Test
  void rejectsNonPositiveCeiling() {
    LuceneBm25Index index = mock(LuceneBm25Index.class);

    assertThatThrownBy(() -> new LexicalIndexAdapter(index, catalog, 0.0, 3))
        .isInstanceOf(ConfigurationException.class);
  }
}
