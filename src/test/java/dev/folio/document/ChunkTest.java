package dev.folio.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.folio.fixture.ChunkBuilder;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import org.junit.jupiter.api.Test;

class ChunkTest {

  private static final Embedding EMBEDDING = Embedding.from(new float[] {1.0f, 0.0f});

  @Test
  void rejectsBlankId() {
    assertThatThrownBy(() -> new Chunk(" ", "text", "doc", 0, EMBEDDING))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("id");
  }

  @Test
  void rejectsNegativePosition() {
    assertThatThrownBy(() -> new Chunk("c1", "text", "doc", -1, EMBEDDING))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nullMetadataBecomesEmpty() {
    Chunk chunk = new Chunk("c1", "text", "doc", 0, EMBEDDING, null);

    assertThat(chunk.metadata().toMap()).isEmpty();
  }

  @Test
  void metadataIsCopiedOnTheWayInAndOut() {
    Metadata metadata = new Metadata().put("lang", "en");
    Chunk chunk = new Chunk("c1", "text", "doc", 0, EMBEDDING, metadata);

    metadata.put("lang", "fr");
    chunk.metadata().put("lang", "de");

    assertThat(chunk.metadata().getString("lang")).isEqualTo("en");
  }

  @Test
  void searchableMetadataAddsDocumentAndPosition() {
    Chunk chunk =
        new ChunkBuilder().sourceDocumentId("guide").position(3).metadata("lang", "en").build();

    Metadata searchable = chunk.searchableMetadata();

    assertThat(searchable.getString(Chunk.SOURCE_DOCUMENT_ID)).isEqualTo("guide");
    assertThat(searchable.getInteger(Chunk.POSITION)).isEqualTo(3);
    assertThat(searchable.getString("lang")).isEqualTo("en");
    assertThat(chunk.metadata().containsKey(Chunk.SOURCE_DOCUMENT_ID)).isFalse();
  }

  @Test
  void textSegmentCarriesSearchableMetadata() {
    Chunk chunk = new ChunkBuilder().text("hello").sourceDocumentId("guide").build();

    TextSegment segment = chunk.toTextSegment();

    assertThat(segment.text()).isEqualTo("hello");
    assertThat(segment.metadata().getString(Chunk.SOURCE_DOCUMENT_ID)).isEqualTo("guide");
  }
}
