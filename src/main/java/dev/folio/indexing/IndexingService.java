package dev.folio.indexing;

import dev.folio.document.Chunk;
import dev.folio.document.ChunkCatalog;
import dev.folio.search.model.RetrievalAdapter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for chunks produced by the ingestion pipeline. Registers chunks in the {@link
 * ChunkCatalog} and writes them to every retrieval adapter.
 *
 * <p>Every chunk is validated against every adapter before anything is written, so a dimension
 * mismatch leaves all indexes untouched. The catalog is written last: search results are resolved
 * through it, so if an adapter fails partway through a batch, the chunks already written to
 * earlier adapters stay invisible to searches. Re-indexing the batch replaces them, keyed by chunk
 * id.
 */
@Service
public class IndexingService {

  private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

  private final ChunkCatalog catalog;
  private final List<RetrievalAdapter> adapters;

  public IndexingService(ChunkCatalog catalog, List<RetrievalAdapter> adapters) {
    this.catalog = catalog;
    this.adapters = List.copyOf(adapters);
  }

  /**
   * Indexes chunks everywhere.
   *
   * @throws dev.folio.exception.ConfigurationException if any chunk is incompatible with an
   *     adapter; nothing is written in that case
   * @throws dev.folio.exception.BackendUnavailableException if an adapter fails to write; the
   *     catalog is left unchanged
   */
  public void index(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    adapters.forEach(adapter -> adapter.validate(chunks));
    for (RetrievalAdapter adapter : adapters) {
      adapter.index(chunks);
    }
    catalog.putAll(chunks);
    log.info("Indexed {} chunks into {} adapters", chunks.size(), adapters.size());
  }

  /**
   * Removes a document's chunks from the catalog and every adapter.
   *
   * @return the number of chunks removed from the catalog
   */
  public int removeDocument(String sourceDocumentId) {
    for (RetrievalAdapter adapter : adapters) {
      adapter.removeDocument(sourceDocumentId);
    }
    List<String> removed = catalog.removeDocument(sourceDocumentId);
    log.info("Removed document {} ({} chunks)", sourceDocumentId, removed.size());
    return removed.size();
  }
}
