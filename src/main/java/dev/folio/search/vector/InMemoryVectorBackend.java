package dev.folio.search.vector;

import dev.folio.document.Chunk;
import dev.folio.exception.ConfigurationException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;

/**
 * Exhaustive in-process vector backend scoring with a configurable native metric. Filters are
 * evaluated natively against each chunk's searchable metadata.
 *
 * <p>Raw scores are reported exactly as the metric defines them: cosine similarity, Euclidean
 * distance or inner product.
 */
public class InMemoryVectorBackend implements VectorStoreBackend {

  private final String name;
  private final VectorMetric metric;
  private final int dimension;
  private final Map<String, Chunk> entries = new ConcurrentHashMap<>();

  public InMemoryVectorBackend(String name, VectorMetric metric, int dimension) {
    if (metric == VectorMetric.UNKNOWN_RANGE) {
      throw new ConfigurationException("In-memory backend " + name + " needs a concrete metric");
    }
    if (dimension < 1) {
      throw new ConfigurationException("Vector dimension must be positive, got " + dimension);
    }
    this.name = name;
    this.metric = metric;
    this.dimension = dimension;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public BackendCapability capability() {
    return new BackendCapability(metric, true);
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public void add(List<Chunk> chunks) {
    chunks.forEach(chunk -> entries.put(chunk.id(), chunk));
  }

  @Override
  public void removeDocument(String sourceDocumentId) {
    entries.values().removeIf(chunk -> chunk.sourceDocumentId().equals(sourceDocumentId));
  }

  @Override
  public List<RawVectorHit> search(Embedding queryEmbedding, int k, @Nullable Filter filter) {
    Comparator<RawVectorHit> bestFirst = Comparator.comparingDouble(RawVectorHit::rawScore);
    if (!metric.isDistance()) {
      bestFirst = bestFirst.reversed();
    }
    return entries.values().stream()
        .filter(chunk -> filter == null || filter.test(chunk.searchableMetadata()))
        .map(chunk -> new RawVectorHit(chunk.id(), score(queryEmbedding, chunk.embedding())))
        .sorted(bestFirst.thenComparing(RawVectorHit::chunkId))
        .limit(k)
        .toList();
  }

  public int size() {
    return entries.size();
  }

  private double score(Embedding query, Embedding candidate) {
    return switch (metric) {
      case COSINE -> CosineSimilarity.between(query, candidate);
      case L2 -> euclideanDistance(query.vector(), candidate.vector());
      case DOT -> dotProduct(query.vector(), candidate.vector());
      case UNKNOWN_RANGE -> throw new IllegalStateException("unreachable");
    };
  }

  static double euclideanDistance(float[] a, float[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double diff = a[i] - b[i];
      sum += diff * diff;
    }
    return Math.sqrt(sum);
  }

  static double dotProduct(float[] a, float[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }
}
