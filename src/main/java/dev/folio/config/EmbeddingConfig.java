package dev.folio.config;

import dev.folio.search.vector.QueryEmbedder;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding and scoring models.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. Setting {@code folio.embedding.model=none} leaves the
 * embedding model to another configuration. The cross-encoder is only created when {@code
 * folio.reranker.model-path} is set; without it, reranking keeps the fused order.
 */
@Configuration
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries, never to documents.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  @ConditionalOnProperty(
      name = "folio.embedding.model",
      havingValue = "bge-small-en-v15-q",
      matchIfMissing = true)
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Provides the in-process ONNX cross-encoder scoring model (ms-marco-MiniLM-L-6-v2) for
   * reranking search results.
   *
   * @param modelPath path to the ONNX model file
   * @param tokenizerPath path to the tokenizer JSON file
   * @return a ready-to-use scoring model for cross-encoder reranking
   */
  @Bean
  @ConditionalOnProperty(prefix = "folio.reranker", name = "model-path")
  public ScoringModel scoringModel(
      @Value("${folio.reranker.model-path}") String modelPath,
      @Value("${folio.reranker.tokenizer-path}") String tokenizerPath) {
    log.info("Loading cross-encoder from {}", modelPath);
    return new OnnxScoringModel(modelPath, tokenizerPath);
  }

  /**
   * Wraps whichever {@link EmbeddingModel} is present. Without one, semantic adapters report
   * themselves unavailable and searches fall back to lexical results.
   */
  @Bean
  public QueryEmbedder queryEmbedder(
      ObjectProvider<EmbeddingModel> embeddingModel,
      @Value("${folio.embedding.query-prefix:" + BGE_QUERY_PREFIX + "}") String queryPrefix) {
    EmbeddingModel model = embeddingModel.getIfAvailable();
    if (model == null) {
      log.warn("No embedding model configured, semantic search is disabled");
    }
    return new QueryEmbedder(model, queryPrefix);
  }
}
