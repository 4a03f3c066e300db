package dev.folio.document;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;

/**
 * Immutable unit of retrievable content produced by the ingestion pipeline.
 *
 * @param id stable, unique chunk identifier
 * @param text the chunk text
 * @param sourceDocumentId identifier of the document the chunk was cut from
 * @param position ordinal of the chunk within its document
 * @param embedding pre-computed embedding, dimensionality fixed per embedding model
 * @param metadata opaque key-value metadata (never null; defensively copied)
 */
public record Chunk(
    String id,
    String text,
    String sourceDocumentId,
    int position,
    Embedding embedding,
    Metadata metadata) {

  /** Metadata key holding {@link #sourceDocumentId()} in {@link #searchableMetadata()}. */
  public static final String SOURCE_DOCUMENT_ID = "source_document_id";

  /** Metadata key holding {@link #position()} in {@link #searchableMetadata()}. */
  public static final String POSITION = "position";

  public Chunk {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Chunk id must not be blank");
    }
    if (text == null) {
      throw new IllegalArgumentException("Chunk text must not be null");
    }
    if (sourceDocumentId == null || sourceDocumentId.isBlank()) {
      throw new IllegalArgumentException("sourceDocumentId must not be blank");
    }
    if (position < 0) {
      throw new IllegalArgumentException("position must not be negative");
    }
    if (embedding == null) {
      throw new IllegalArgumentException("Chunk embedding must not be null");
    }
    metadata = metadata == null ? new Metadata() : metadata.copy();
  }

  /** Convenience constructor for chunks without metadata. */
  public Chunk(
      String id, String text, String sourceDocumentId, int position, Embedding embedding) {
    this(id, text, sourceDocumentId, position, embedding, null);
  }

  @Override
  public Metadata metadata() {
    return metadata.copy();
  }

  /**
   * Metadata used for filtering: the chunk's own metadata plus {@value #SOURCE_DOCUMENT_ID} and
   * {@value #POSITION}, so callers can restrict a search to given documents.
   */
  public Metadata searchableMetadata() {
    return metadata.copy().put(SOURCE_DOCUMENT_ID, sourceDocumentId).put(POSITION, position);
  }

  public int dimension() {
    return embedding.dimension();
  }

  /** Converts to a LangChain4j segment carrying the searchable metadata. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, searchableMetadata());
  }
}
