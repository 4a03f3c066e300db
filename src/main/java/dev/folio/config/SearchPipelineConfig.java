package dev.folio.config;

import dev.folio.search.SearchProperties;
import dev.folio.search.decompose.LlmQueryDecomposer;
import dev.folio.search.decompose.QueryDecomposer;
import dev.folio.search.decompose.RuleBasedQueryDecomposer;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pool and decomposition strategy for the search pipeline. */
@Configuration
public class SearchPipelineConfig {

  private static final Logger log = LoggerFactory.getLogger(SearchPipelineConfig.class);

  /**
   * Bounded pool running adapter calls, query embedding and reranking. Sized by {@code
   * folio.search.max-concurrency}; work beyond the queue is rejected and the affected adapter is
   * treated as unavailable.
   */
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor(SearchProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getMaxConcurrency());
    executor.setMaxPoolSize(properties.getMaxConcurrency());
    executor.setQueueCapacity(properties.getMaxConcurrency() * 32);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }

  /** LLM decomposition when a {@link ChatModel} bean exists, rule-based otherwise. */
  @Bean
  public QueryDecomposer queryDecomposer(
      SearchProperties properties, ObjectProvider<ChatModel> chatModel) {
    RuleBasedQueryDecomposer rules = new RuleBasedQueryDecomposer(properties.getMaxSubQueries());
    ChatModel model = chatModel.getIfAvailable();
    if (model == null) {
      return rules;
    }
    log.info("Using LLM query decomposition");
    return new LlmQueryDecomposer(model, rules, properties.getMaxSubQueries());
  }
}
