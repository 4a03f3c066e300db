package dev.folio.search.model;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.filter.Filter;
import org.jspecify.annotations.Nullable;

/**
 * A request to a single retrieval adapter.
 *
 * @param text the (sub-)query text, used by lexical adapters
 * @param k maximum number of hits to return
 * @param filter optional metadata filter
 * @param subQueryIndex decomposition index recorded in result provenance, or null
 * @param embedding the query embedding, required by semantic adapters
 */
public record RetrievalQuery(
    String text,
    int k,
    @Nullable Filter filter,
    @Nullable Integer subQueryIndex,
    @Nullable Embedding embedding) {

  public RetrievalQuery {
    if (text == null) {
      throw new IllegalArgumentException("Query text must not be null");
    }
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1, got " + k);
    }
  }

  public RetrievalQuery(String text, int k) {
    this(text, k, null, null, null);
  }

  public RetrievalQuery withEmbedding(Embedding queryEmbedding) {
    return new RetrievalQuery(text, k, filter, subQueryIndex, queryEmbedding);
  }
}
