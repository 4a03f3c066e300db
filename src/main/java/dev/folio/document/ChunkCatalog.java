package dev.folio.document;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe lookup of indexed chunks by id. Used to resolve citation text and metadata for
 * search results, to feed candidate text to the reranker, and to post-filter hits from backends
 * that cannot filter on metadata themselves.
 */
@Component
public class ChunkCatalog {

  private final Map<String, Chunk> chunks = new ConcurrentHashMap<>();

  public void put(Chunk chunk) {
    chunks.put(chunk.id(), chunk);
  }

  public void putAll(Collection<Chunk> batch) {
    batch.forEach(this::put);
  }

  public Optional<Chunk> find(String chunkId) {
    return Optional.ofNullable(chunks.get(chunkId));
  }

  /**
   * Removes every chunk belonging to a document.
   *
   * @param sourceDocumentId the document identifier
   * @return the ids of the removed chunks
   */
  public List<String> removeDocument(String sourceDocumentId) {
    List<String> removed =
        chunks.values().stream()
            .filter(c -> c.sourceDocumentId().equals(sourceDocumentId))
            .map(Chunk::id)
            .sorted()
            .toList();
    removed.forEach(chunks::remove);
    return removed;
  }

  public int size() {
    return chunks.size();
  }
}
