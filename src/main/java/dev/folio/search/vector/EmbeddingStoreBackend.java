package dev.folio.search.vector;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.folio.document.Chunk;
import dev.folio.exception.BackendUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend over any LangChain4j {@link EmbeddingStore} (pgvector in production).
 *
 * <p>LangChain4j stores report a relevance score derived from cosine similarity ({@code (cos + 1) /
 * 2}). This backend converts it back to the native cosine similarity so the raw score recorded in
 * provenance is the backend's real metric, and declares {@link VectorMetric#COSINE}.
 */
public class EmbeddingStoreBackend implements VectorStoreBackend {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreBackend.class);

  private final String name;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final int dimension;

  public EmbeddingStoreBackend(
      String name, EmbeddingStore<TextSegment> embeddingStore, int dimension) {
    this.name = name;
    this.embeddingStore = embeddingStore;
    this.dimension = dimension;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public BackendCapability capability() {
    return new BackendCapability(VectorMetric.COSINE, true);
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public void add(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    embeddingStore.addAll(
        chunks.stream().map(Chunk::id).toList(),
        chunks.stream().map(Chunk::embedding).toList(),
        chunks.stream().map(Chunk::toTextSegment).toList());
    log.debug("Stored {} chunks in {}", chunks.size(), name);
  }

  @Override
  public void removeDocument(String sourceDocumentId) {
    embeddingStore.removeAll(metadataKey(Chunk.SOURCE_DOCUMENT_ID).isEqualTo(sourceDocumentId));
  }

  @Override
  public List<RawVectorHit> search(Embedding queryEmbedding, int k, @Nullable Filter filter) {
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(k);
    if (filter != null) {
      builder.filter(filter);
    }

    List<EmbeddingMatch<TextSegment>> matches;
    try {
      matches = embeddingStore.search(builder.build()).matches();
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(name, "embedding store search failed", e);
    }
    return matches.stream()
        .map(
            match ->
                new RawVectorHit(
                    match.embeddingId(), CosineSimilarity.fromRelevanceScore(match.score())))
        .toList();
  }
}
