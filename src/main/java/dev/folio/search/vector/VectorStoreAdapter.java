package dev.folio.search.vector;

import dev.folio.document.Chunk;
import dev.folio.document.ChunkCatalog;
import dev.folio.exception.ConfigurationException;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.ResultSource;
import dev.folio.search.model.RetrievalAdapter;
import dev.folio.search.model.RetrievalQuery;
import dev.folio.search.model.ScoredResult;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semantic retrieval adapter over a {@link VectorStoreBackend}.
 *
 * <p>Converts backend-native scores to relevance in [0, 1] with {@link ScoreNormaliser}, using the
 * returned batch as context, then orders by relevance descending with chunk id as tie-break. When
 * a filter is requested and the backend cannot filter natively, the adapter over-fetches by the
 * fetch multiplier and filters on the catalog's copy of each chunk's metadata.
 */
public class VectorStoreAdapter implements RetrievalAdapter {

  private static final Logger log = LoggerFactory.getLogger(VectorStoreAdapter.class);

  private final VectorStoreBackend backend;
  private final ChunkCatalog catalog;
  private final int fetchMultiplier;

  public VectorStoreAdapter(VectorStoreBackend backend, ChunkCatalog catalog, int fetchMultiplier) {
    if (fetchMultiplier < 1) {
      throw new ConfigurationException(
          "fetch multiplier must be at least 1, got " + fetchMultiplier);
    }
    this.backend = backend;
    this.catalog = catalog;
    this.fetchMultiplier = fetchMultiplier;
  }

  @Override
  public String name() {
    return backend.name();
  }

  @Override
  public AdapterKind kind() {
    return AdapterKind.SEMANTIC;
  }

  public int dimension() {
    return backend.dimension();
  }

  public BackendCapability capability() {
    return backend.capability();
  }

  @Override
  public RankedList search(RetrievalQuery query) {
    Embedding embedding = query.embedding();
    if (embedding == null) {
      throw new IllegalArgumentException("Semantic adapter " + name() + " needs a query embedding");
    }
    return search(embedding, query.k(), query.filter(), query.subQueryIndex());
  }

  /**
   * Returns the top-k chunks by normalised relevance.
   *
   * @param queryEmbedding the query vector
   * @param k maximum number of hits
   * @param filter optional metadata filter
   * @return ranked list, at most {@code k} entries
   * @throws ConfigurationException if the embedding dimension differs from the backend's
   */
  public RankedList search(Embedding queryEmbedding, int k, @Nullable Filter filter) {
    return search(queryEmbedding, k, filter, null);
  }

  private RankedList search(
      Embedding queryEmbedding, int k, @Nullable Filter filter, @Nullable Integer subQueryIndex) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1, got " + k);
    }
    if (queryEmbedding.dimension() != backend.dimension()) {
      throw new ConfigurationException(
          "Query embedding has dimension "
              + queryEmbedding.dimension()
              + " but "
              + name()
              + " expects "
              + backend.dimension());
    }

    BackendCapability capability = backend.capability();
    boolean postFilter = filter != null && !capability.supportsMetadataFiltering();
    int fetchK = postFilter ? saturatedMultiply(k, fetchMultiplier) : k;

    List<RawVectorHit> hits =
        backend.search(queryEmbedding, fetchK, postFilter ? null : filter);
    if (postFilter) {
      hits = hits.stream().filter(hit -> matches(hit.chunkId(), filter)).toList();
    }

    ScoreNormaliser.BatchContext batch =
        ScoreNormaliser.BatchContext.of(hits.stream().map(RawVectorHit::rawScore).toList());
    List<Candidate> candidates = new ArrayList<>(hits.size());
    for (RawVectorHit hit : hits) {
      candidates.add(
          new Candidate(
              hit.chunkId(),
              hit.rawScore(),
              ScoreNormaliser.normalise(hit.rawScore(), capability.metric(), batch)));
    }
    candidates.sort(
        Comparator.comparingDouble(Candidate::normalised)
            .reversed()
            .thenComparing(Candidate::chunkId));

    ResultSource source = new ResultSource(name(), AdapterKind.SEMANTIC, subQueryIndex);
    List<ScoredResult> results = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Candidate candidate : candidates) {
      if (results.size() == k) {
        break;
      }
      if (seen.add(candidate.chunkId())) {
        results.add(
            new ScoredResult(
                candidate.chunkId(),
                candidate.raw(),
                candidate.normalised(),
                results.size() + 1,
                source));
      }
    }
    log.debug("{} returned {} of {} hits", name(), results.size(), hits.size());
    return new RankedList(name(), AdapterKind.SEMANTIC, results);
  }

  @Override
  public void validate(List<Chunk> chunks) {
    for (Chunk chunk : chunks) {
      if (chunk.dimension() != backend.dimension()) {
        throw new ConfigurationException(
            "Chunk "
                + chunk.id()
                + " has dimension "
                + chunk.dimension()
                + " but "
                + name()
                + " expects "
                + backend.dimension());
      }
    }
  }

  @Override
  public void index(List<Chunk> chunks) {
    validate(chunks);
    backend.add(chunks);
  }

  @Override
  public void removeDocument(String sourceDocumentId) {
    backend.removeDocument(sourceDocumentId);
  }

  @Override
  public void close() {
    backend.close();
  }

  private boolean matches(String chunkId, Filter filter) {
    return catalog.find(chunkId).map(c -> filter.test(c.searchableMetadata())).orElse(false);
  }

  private static int saturatedMultiply(int a, int b) {
    long product = (long) a * b;
    return product > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) product;
  }

  private record Candidate(String chunkId, double raw, double normalised) {}
}
