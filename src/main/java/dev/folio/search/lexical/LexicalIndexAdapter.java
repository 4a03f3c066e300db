package dev.folio.search.lexical;

import dev.folio.document.Chunk;
import dev.folio.document.ChunkCatalog;
import dev.folio.exception.ConfigurationException;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.ResultSource;
import dev.folio.search.model.RetrievalAdapter;
import dev.folio.search.model.RetrievalQuery;
import dev.folio.search.model.ScoredResult;
import dev.folio.search.vector.ScoreNormaliser;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Keyword retrieval adapter over a {@link LuceneBm25Index}. BM25 scores are saturated against a
 * configured ceiling to give relevance in [0, 1]. Metadata filters are applied after the search
 * on the catalog copy of each chunk, over-fetching by the fetch multiplier.
 */
public class LexicalIndexAdapter implements RetrievalAdapter {

  private final LuceneBm25Index index;
  private final ChunkCatalog catalog;
  private final double scoreCeiling;
  private final int fetchMultiplier;

  public LexicalIndexAdapter(
      LuceneBm25Index index, ChunkCatalog catalog, double scoreCeiling, int fetchMultiplier) {
    if (!(scoreCeiling > 0.0) || Double.isInfinite(scoreCeiling)) {
      throw new ConfigurationException(
          "lexical score ceiling must be positive, got " + scoreCeiling);
    }
    if (fetchMultiplier < 1) {
      throw new ConfigurationException(
          "fetch multiplier must be at least 1, got " + fetchMultiplier);
    }
    this.index = index;
    this.catalog = catalog;
    this.scoreCeiling = scoreCeiling;
    this.fetchMultiplier = fetchMultiplier;
  }

  @Override
  public String name() {
    return index.name();
  }

  @Override
  public AdapterKind kind() {
    return AdapterKind.LEXICAL;
  }

  @Override
  public RankedList search(RetrievalQuery query) {
    return search(query.text(), query.k(), query.filter(), query.subQueryIndex());
  }

  public RankedList search(String text, int k) {
    return search(text, k, null, null);
  }

  public RankedList search(String text, int k, @Nullable Filter filter) {
    return search(text, k, filter, null);
  }

  private RankedList search(
      String text, int k, @Nullable Filter filter, @Nullable Integer subQueryIndex) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1, got " + k);
    }
    int fetchK = filter == null ? k : (int) Math.min(Integer.MAX_VALUE, (long) k * fetchMultiplier);
    List<LexicalHit> hits = index.search(text, fetchK);
    if (filter != null) {
      hits =
          hits.stream()
              .filter(
                  hit ->
                      catalog
                          .find(hit.chunkId())
                          .map(c -> filter.test(c.searchableMetadata()))
                          .orElse(false))
              .toList();
    }

    List<LexicalHit> ordered = new ArrayList<>(hits);
    ordered.sort(
        Comparator.comparingDouble(LexicalHit::score)
            .reversed()
            .thenComparing(LexicalHit::chunkId));

    ResultSource source = new ResultSource(name(), AdapterKind.LEXICAL, subQueryIndex);
    List<ScoredResult> results = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (LexicalHit hit : ordered) {
      if (results.size() == k) {
        break;
      }
      if (seen.add(hit.chunkId())) {
        results.add(
            new ScoredResult(
                hit.chunkId(),
                hit.score(),
                ScoreNormaliser.saturate(hit.score(), scoreCeiling),
                results.size() + 1,
                source));
      }
    }
    return new RankedList(name(), AdapterKind.LEXICAL, results);
  }

  @Override
  public void index(List<Chunk> chunks) {
    index.add(chunks);
  }

  @Override
  public void removeDocument(String sourceDocumentId) {
    index.removeDocument(sourceDocumentId);
  }

  @Override
  public void close() {
    index.close();
  }
}
