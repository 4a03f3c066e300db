package dev.folio.search.vector;

import dev.folio.document.Chunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Contract every vector storage backend satisfies. Backends report raw, backend-native scores;
 * normalisation is the job of {@link VectorStoreAdapter}. Implementations must be safe for
 * concurrent use.
 */
public interface VectorStoreBackend extends AutoCloseable {

  String name();

  BackendCapability capability();

  /** Embedding dimensionality accepted by the backend. */
  int dimension();

  void add(List<Chunk> chunks);

  void removeDocument(String sourceDocumentId);

  /**
   * Nearest-neighbour search.
   *
   * @param queryEmbedding the query vector, already checked against {@link #dimension()}
   * @param k maximum number of hits
   * @param filter metadata filter; only passed when {@link
   *     BackendCapability#supportsMetadataFiltering()} is true
   * @return hits in any order with raw scores
   * @throws dev.folio.exception.BackendUnavailableException if the backend cannot be reached
   */
  List<RawVectorHit> search(Embedding queryEmbedding, int k, @Nullable Filter filter);

  @Override
  default void close() {}
}
