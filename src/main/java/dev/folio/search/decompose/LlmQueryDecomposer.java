package dev.folio.search.decompose;

import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decomposer that asks a chat model to break the query down, one sub-query per response line.
 * Numbering, bullets and surrounding quotes are stripped. Falls back to the rule-based decomposer
 * when the model fails or returns nothing usable.
 */
public class LlmQueryDecomposer implements QueryDecomposer {

  private static final Logger log = LoggerFactory.getLogger(LlmQueryDecomposer.class);

  static final String PROMPT_TEMPLATE =
      """
      Break down this search query into simpler sub-queries.
      Return each sub-query on a new line.
      Only return the sub-queries, no explanations.
      If the query is already simple, return just the original query.

      Query: %s

      Sub-queries:""";

  private static final Pattern NUMBERING = Pattern.compile("^\\d+[.)]\\s*");
  private static final Pattern BULLET = Pattern.compile("^[-*\\u2022]\\s*");
  private static final Pattern QUOTES = Pattern.compile("^[\"']+|[\"']+$");

  private final ChatModel chatModel;
  private final QueryDecomposer fallback;
  private final int maxSubQueries;

  public LlmQueryDecomposer(ChatModel chatModel, QueryDecomposer fallback, int maxSubQueries) {
    this.chatModel = chatModel;
    this.fallback = fallback;
    this.maxSubQueries = maxSubQueries;
  }

  @Override
  public List<SubQuery> decompose(String query) {
    if (query == null || query.isBlank()) {
      return fallback.decompose(query);
    }
    String response;
    try {
      response = chatModel.chat(PROMPT_TEMPLATE.formatted(query.strip()));
    } catch (RuntimeException e) {
      log.warn("LLM decomposition failed, falling back to rules: {}", e.getMessage());
      return fallback.decompose(query);
    }

    List<SubQuery> subQueries =
        RuleBasedQueryDecomposer.distinct(parse(response), maxSubQueries, SubQueryOrigin.LLM);
    if (subQueries.isEmpty()) {
      log.debug("LLM returned no sub-queries for '{}', falling back to rules", query);
      return fallback.decompose(query);
    }
    return subQueries;
  }

  static List<String> parse(String response) {
    if (response == null) {
      return List.of();
    }
    List<String> lines = new ArrayList<>();
    for (String line : response.strip().split("\\R")) {
      String cleaned = NUMBERING.matcher(line.strip()).replaceFirst("");
      cleaned = BULLET.matcher(cleaned).replaceFirst("");
      cleaned = QUOTES.matcher(cleaned.strip()).replaceAll("").strip();
      if (!cleaned.isEmpty()) {
        lines.add(cleaned);
      }
    }
    return lines;
  }
}
