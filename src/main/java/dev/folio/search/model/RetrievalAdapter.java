package dev.folio.search.model;

import dev.folio.document.Chunk;
import java.util.List;

/**
 * Uniform view of a searchable backend, semantic or lexical. Implementations own their backend
 * connection, must be safe for concurrent use, and release resources in {@link #close()}.
 */
public interface RetrievalAdapter extends AutoCloseable {

  /** Unique adapter name; doubles as the id of the ranked lists it produces. */
  String name();

  AdapterKind kind();

  /**
   * Searches the backend.
   *
   * @param query the adapter query; semantic adapters require {@link RetrievalQuery#embedding()}
   * @return a dense ranked list, empty when nothing matched
   * @throws dev.folio.exception.BackendUnavailableException if the backend cannot be reached
   * @throws dev.folio.exception.ConfigurationException on an embedding dimension mismatch
   */
  RankedList search(RetrievalQuery query);

  /**
   * Checks that chunks can be indexed by this adapter without writing anything.
   *
   * @throws dev.folio.exception.ConfigurationException if a chunk is incompatible
   */
  default void validate(List<Chunk> chunks) {}

  void index(List<Chunk> chunks);

  void removeDocument(String sourceDocumentId);

  @Override
  default void close() {}
}
