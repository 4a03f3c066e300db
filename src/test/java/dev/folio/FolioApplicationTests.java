package dev.folio;

import static org.assertj.core.api.Assertions.assertThat;

import dev.folio.fixture.ChunkBuilder;
import dev.folio.fixture.HashingEmbeddingModel;
import dev.folio.indexing.IndexingService;
import dev.folio.search.SearchMode;
import dev.folio.search.SearchRequest;
import dev.folio.search.SearchResponse;
import dev.folio.search.SearchResult;
import dev.folio.search.SearchService;
import dev.folio.search.model.RetrievalAdapter;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/** Boots the full context with a deterministic embedding model and runs an index-then-search. */
@SpringBootTest(
    properties = {
      "folio.embedding.model=none",
      "folio.onnx.configure-threading=false",
      "folio.vector.dimension=" + ChunkBuilder.DIMENSION
    })
class FolioApplicationTests {

  @TestConfiguration
  static class TestEmbeddingConfig {

    @Bean
    EmbeddingModel embeddingModel() {
      return new HashingEmbeddingModel(ChunkBuilder.DIMENSION);
    }
  }

  @Autowired private IndexingService indexingService;

  @Autowired private SearchService searchService;

  @Autowired private List<RetrievalAdapter> adapters;

  @Test
  void contextWiresDefaultAdapters() {
    assertThat(adapters)
        .extracting(RetrievalAdapter::name)
        .containsExactlyInAnyOrder("in-memory-vector", "lexical-bm25");
  }

  @Test
  void indexedChunksAreSearchable() {
    indexingService.index(
        List.of(
            new ChunkBuilder()
                .id("ctx-kafka")
                .sourceDocumentId("ctx-doc-1")
                .text("Kafka consumer groups balance partitions across consumers")
                .build(),
            new ChunkBuilder()
                .id("ctx-spring")
                .sourceDocumentId("ctx-doc-2")
                .text("Spring beans are created by the application context")
                .build()));

    SearchResponse hybrid = searchService.search(new SearchRequest("kafka partitions", 5));
    SearchResponse keyword =
        searchService.search(
            new SearchRequest(
                "kafka partitions", SearchMode.KEYWORD, false, false, 5, null, null, null, null));

    assertThat(hybrid.results()).extracting(SearchResult::chunkId).contains("ctx-kafka");
    assertThat(hybrid.unavailableAdapters()).isEmpty();
    assertThat(keyword.results())
        .extracting(SearchResult::chunkId)
        .containsExactly("ctx-kafka");
  }
}
