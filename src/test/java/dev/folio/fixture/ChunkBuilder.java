package dev.folio.fixture;

import dev.folio.document.Chunk;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;

/**
 * Lightweight test builder for {@link Chunk}. Provides sensible defaults so tests only override
 * what they care about; without an explicit embedding the text is embedded with a {@link
 * HashingEmbeddingModel} of the configured dimension.
 *
 * <pre>{@code
 * Chunk chunk = new ChunkBuilder().id("c1").text("Some content").build();
 * }</pre>
 */
public final class ChunkBuilder {

  public static final int DIMENSION = 8;

  private String id = "chunk-1";
  private String text = "Sample documentation text for testing.";
  private String sourceDocumentId = "doc-1";
  private int position = 0;
  private int dimension = DIMENSION;
  private Embedding embedding;
  private Metadata metadata = new Metadata();

  public ChunkBuilder id(String id) {
    this.id = id;
    return this;
  }

  public ChunkBuilder text(String text) {
    this.text = text;
    return this;
  }

  public ChunkBuilder sourceDocumentId(String sourceDocumentId) {
    this.sourceDocumentId = sourceDocumentId;
    return this;
  }

  public ChunkBuilder position(int position) {
    this.position = position;
    return this;
  }

  public ChunkBuilder dimension(int dimension) {
    this.dimension = dimension;
    return this;
  }

  public ChunkBuilder embedding(float... vector) {
    this.embedding = Embedding.from(vector);
    return this;
  }

  public ChunkBuilder metadata(String key, String value) {
    this.metadata.put(key, value);
    return this;
  }

  public Chunk build() {
    Embedding vector =
        embedding != null ? embedding : new HashingEmbeddingModel(dimension).vectorFor(text);
    return new Chunk(id, text, sourceDocumentId, position, vector, metadata);
  }
}
