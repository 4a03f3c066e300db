package dev.folio.search.decompose;

import dev.folio.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based decomposer. Rules are tried in order and the first that yields sub-queries wins:
 *
 * <ol>
 *   <li>comparisons: {@code X vs Y}, {@code X versus Y}, {@code X compared to/with Y}, {@code
 *       difference between X and Y}, each optionally followed by a shared context introduced by
 *       {@code for}, {@code in terms of} or {@code regarding}
 *   <li>multi-aspect: {@code <topic> for <a> and <b>} becomes {@code <topic> <a>}, {@code <topic>
 *       <b>}
 *   <li>conjunctions: split on {@code and}, {@code or}, {@code also}, {@code as well as}, keeping
 *       parts longer than three characters
 * </ol>
 *
 * <p>Results are de-duplicated case-insensitively and capped.
 */
public class RuleBasedQueryDecomposer implements QueryDecomposer {

  private static final String CONTEXT = "(?:\\s+(?:for|in\\s+terms\\s+of|regarding)\\s+(.+?))?";
  private static final String END = "[\\s?.!]*$";

  private static final Pattern DIFFERENCE =
      Pattern.compile(
          "\\bdifference\\s+between\\s+(.+?)\\s+and\\s+(.+?)" + CONTEXT + END,
          Pattern.CASE_INSENSITIVE);

  private static final Pattern COMPARISON =
      Pattern.compile(
          "^(.+?)\\s+(?:vs\\.?|versus|compared\\s+to|compared\\s+with)\\s+(.+?)" + CONTEXT + END,
          Pattern.CASE_INSENSITIVE);

  private static final Pattern MULTI_ASPECT =
      Pattern.compile(
          "^(.+?)\\s+(?:for|in\\s+terms\\s+of|regarding)\\s+(.+?)\\s+and\\s+(.+?)" + END,
          Pattern.CASE_INSENSITIVE);

  private static final Pattern CONJUNCTION =
      Pattern.compile("\\s+(?:and|or|also|as\\s+well\\s+as)\\s+", Pattern.CASE_INSENSITIVE);

  private static final int MIN_PART_LENGTH = 4;

  private final int maxSubQueries;

  public RuleBasedQueryDecomposer(int maxSubQueries) {
    if (maxSubQueries < 1) {
      throw new ConfigurationException("max sub-queries must be at least 1, got " + maxSubQueries);
    }
    this.maxSubQueries = maxSubQueries;
  }

  @Override
  public List<SubQuery> decompose(String query) {
    String text = query == null ? "" : query.strip();
    if (text.isEmpty()) {
      return List.of(SubQuery.of(query == null ? "" : query, SubQueryOrigin.RULE));
    }

    List<String> parts = comparison(text);
    if (parts.isEmpty()) {
      parts = multiAspect(text);
    }
    if (parts.isEmpty()) {
      parts = conjunction(text);
    }

    List<SubQuery> subQueries = distinct(parts, maxSubQueries, SubQueryOrigin.RULE);
    if (subQueries.isEmpty()) {
      return List.of(SubQuery.of(text, SubQueryOrigin.RULE));
    }
    return subQueries;
  }

  private static List<String> comparison(String text) {
    Matcher matcher = DIFFERENCE.matcher(text);
    if (!matcher.find()) {
      matcher = COMPARISON.matcher(text);
      if (!matcher.find()) {
        return List.of();
      }
    }
    String context = matcher.group(3);
    List<String> parts = new ArrayList<>(2);
    for (String side : List.of(matcher.group(1), matcher.group(2))) {
      parts.add(context == null ? side.strip() : side.strip() + " " + context.strip());
    }
    return parts;
  }

  private static List<String> multiAspect(String text) {
    Matcher matcher = MULTI_ASPECT.matcher(text);
    if (!matcher.find()) {
      return List.of();
    }
    String topic = matcher.group(1).strip();
    return List.of(topic + " " + matcher.group(2).strip(), topic + " " + matcher.group(3).strip());
  }

  private static List<String> conjunction(String text) {
    String[] split = CONJUNCTION.split(text);
    if (split.length < 2) {
      return List.of();
    }
    List<String> parts = new ArrayList<>();
    for (String part : split) {
      String trimmed = part.strip().replaceAll("[?.!]+$", "");
      if (trimmed.length() >= MIN_PART_LENGTH) {
        parts.add(trimmed);
      }
    }
    return parts;
  }

  /** Drops blank and case-insensitively repeated texts, keeping first occurrences. */
  static List<SubQuery> distinct(List<String> texts, int limit, SubQueryOrigin origin) {
    Map<String, SubQuery> unique = new LinkedHashMap<>();
    for (String text : texts) {
      String key = text.strip().toLowerCase(Locale.ROOT);
      if (!key.isEmpty() && unique.size() < limit) {
        unique.putIfAbsent(key, SubQuery.of(text.strip(), origin));
      }
    }
    return List.copyOf(unique.values());
  }
}
