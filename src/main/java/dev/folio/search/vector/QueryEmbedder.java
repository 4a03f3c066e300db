package dev.folio.search.vector;

import dev.folio.exception.BackendUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.jspecify.annotations.Nullable;

/**
 * Embeds query text with the configured {@link EmbeddingModel}. BGE-style models expect an
 * instruction prefix on queries (but not on documents), applied here. Without a model every call
 * fails as unavailable, so only lexical adapters can answer.
 */
public class QueryEmbedder {

  static final String MODEL_NAME = "embedding-model";

  private final @Nullable EmbeddingModel embeddingModel;
  private final String queryPrefix;

  public QueryEmbedder(@Nullable EmbeddingModel embeddingModel, @Nullable String queryPrefix) {
    this.embeddingModel = embeddingModel;
    this.queryPrefix = queryPrefix == null ? "" : queryPrefix;
  }

  public boolean isAvailable() {
    return embeddingModel != null;
  }

  /**
   * Embeds a query.
   *
   * @throws BackendUnavailableException if no model is configured or the model fails
   */
  public Embedding embed(String text) {
    if (embeddingModel == null) {
      throw new BackendUnavailableException(MODEL_NAME, "no embedding model configured");
    }
    try {
      return embeddingModel.embed(queryPrefix + text).content();
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(MODEL_NAME, "query embedding failed", e);
    }
  }
}
