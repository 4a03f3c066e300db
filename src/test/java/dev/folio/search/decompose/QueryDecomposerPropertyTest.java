package dev.folio.search.decompose;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Locale;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/** Totality and bounds of rule-based decomposition over arbitrary input. */
class QueryDecomposerPropertyTest {

  @Provide
  Arbitrary<String> queries() {
    Arbitrary<String> words =
        Arbitraries.of(
            "and", "or", "vs", "versus", "compared", "to", "with", "for", "difference", "between",
            "regarding", "in", "terms", "of", "also", "as", "well", "kafka", "Kafka", "spring",
            "java", "?", "x");
    return Arbitraries.oneOf(
        words.list().ofMaxSize(12).map(ws -> String.join(" ", ws)),
        Arbitraries.strings().ofMaxLength(60));
  }

  @Property
  void everyQueryYieldsAtLeastOneSubQuery(
      @ForAll("queries") String query, @ForAll @IntRange(min = 1, max = 6) int max) {
    List<SubQuery> subQueries = new RuleBasedQueryDecomposer(max).decompose(query);

    assertThat(subQueries).isNotEmpty().hasSizeLessThanOrEqualTo(max);
    assertThat(subQueries).allSatisfy(sq -> assertThat(sq.weight()).isEqualTo(1.0));
  }

  @Property
  void subQueriesAreDistinctIgnoringCase(@ForAll("queries") String query) {
    List<String> keys =
        new RuleBasedQueryDecomposer(5)
            .decompose(query).stream()
                .map(sq -> sq.text().strip().toLowerCase(Locale.ROOT))
                .toList();

    assertThat(keys).doesNotHaveDuplicates();
  }
}
