package dev.folio.config;

import dev.folio.document.ChunkCatalog;
import dev.folio.exception.ConfigurationException;
import dev.folio.search.SearchProperties;
import dev.folio.search.lexical.LexicalIndexAdapter;
import dev.folio.search.lexical.LuceneBm25Index;
import dev.folio.search.vector.EmbeddingStoreBackend;
import dev.folio.search.vector.InMemoryVectorBackend;
import dev.folio.search.vector.VectorMetric;
import dev.folio.search.vector.VectorStoreAdapter;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the retrieval adapters. Each adapter bean is picked up by the search and indexing
 * services; Spring closes them on shutdown.
 *
 * <ul>
 *   <li>{@code in-memory-vector}: exhaustive in-process vector search (on by default)
 *   <li>{@code pgvector}: LangChain4j pgvector store (only when {@code folio.vector.pgvector.host}
 *       is set)
 *   <li>{@code lexical-bm25}: in-process Lucene BM25 index (on by default)
 * </ul>
 *
 * <p>The configured vector dimension must match the embedding model's, checked at startup.
 *
 * <p>pgvector keeps embeddings across restarts but the {@code ChunkCatalog} is in-memory. Hits
 * whose chunk id is missing from the catalog are dropped at resolution time, so after a restart
 * the corpus must be re-indexed before pgvector results show up again.
 */
@Configuration
public class RetrievalBackendConfig {

  private static final Logger log = LoggerFactory.getLogger(RetrievalBackendConfig.class);

  private final int dimension;

  public RetrievalBackendConfig(
      @Value("${folio.vector.dimension:384}") int dimension,
      ObjectProvider<EmbeddingModel> embeddingModel) {
    if (dimension < 1) {
      throw new ConfigurationException(
          "folio.vector.dimension must be positive, got: " + dimension);
    }
    EmbeddingModel model = embeddingModel.getIfAvailable();
    if (model != null && model.dimension() != dimension) {
      throw new ConfigurationException(
          "folio.vector.dimension is "
              + dimension
              + " but the embedding model produces "
              + model.dimension());
    }
    this.dimension = dimension;
  }

  @Bean
  @ConditionalOnProperty(
      name = "folio.vector.in-memory.enabled",
      havingValue = "true",
      matchIfMissing = true)
  public VectorStoreAdapter inMemoryVectorAdapter(
      ChunkCatalog catalog,
      SearchProperties properties,
      @Value("${folio.vector.in-memory.metric:cosine}") String metric) {
    VectorMetric vectorMetric = VectorMetric.fromValue(metric);
    log.info("In-memory vector backend: metric={}, dimension={}", vectorMetric.value(), dimension);
    return new VectorStoreAdapter(
        new InMemoryVectorBackend("in-memory-vector", vectorMetric, dimension),
        catalog,
        properties.getFetchMultiplier());
  }

  @Bean
  @ConditionalOnProperty(prefix = "folio.vector.pgvector", name = "host")
  public VectorStoreAdapter pgvectorAdapter(
      ChunkCatalog catalog,
      SearchProperties properties,
      @Value("${folio.vector.pgvector.host}") String host,
      @Value("${folio.vector.pgvector.port:5432}") int port,
      @Value("${folio.vector.pgvector.database:folio}") String database,
      @Value("${folio.vector.pgvector.user:folio}") String user,
      @Value("${folio.vector.pgvector.password:}") String password,
      @Value("${folio.vector.pgvector.table:folio_chunks}") String table) {
    EmbeddingStore<TextSegment> store =
        PgVectorEmbeddingStore.builder()
            .host(host)
            .port(port)
            .database(database)
            .user(user)
            .password(password)
            .table(table)
            .dimension(dimension)
            .createTable(true)
            .build();
    log.info("pgvector backend: {}:{}/{} table={}", host, port, database, table);
    return new VectorStoreAdapter(
        new EmbeddingStoreBackend("pgvector", store, dimension),
        catalog,
        properties.getFetchMultiplier());
  }

  @Bean
  @ConditionalOnProperty(
      name = "folio.lexical.enabled",
      havingValue = "true",
      matchIfMissing = true)
  public LexicalIndexAdapter lexicalAdapter(ChunkCatalog catalog, SearchProperties properties) {
    return new LexicalIndexAdapter(
        new LuceneBm25Index("lexical-bm25"),
        catalog,
        properties.getLexicalScoreCeiling(),
        properties.getFetchMultiplier());
  }
}
