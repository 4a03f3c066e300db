package dev.folio.fixture;

import dev.folio.document.Chunk;
import dev.folio.exception.BackendUnavailableException;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.ResultSource;
import dev.folio.search.model.RetrievalAdapter;
import dev.folio.search.model.RetrievalQuery;
import dev.folio.search.model.ScoredResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Adapter returning canned ranked lists, or failing, for pipeline tests. */
public class StubAdapter implements RetrievalAdapter {

  private final String name;
  private final AdapterKind kind;
  private final Function<RetrievalQuery, List<String>> ranking;
  private volatile RuntimeException failure;
  private volatile long delayMillis;
  private final List<RetrievalQuery> queries = new CopyOnWriteArrayList<>();

  public StubAdapter(
      String name, AdapterKind kind, Function<RetrievalQuery, List<String>> ranking) {
    this.name = name;
    this.kind = kind;
    this.ranking = ranking;
  }

  /** Always returns the given chunk ids, best first. */
  public static StubAdapter returning(String name, AdapterKind kind, String... chunkIds) {
    return new StubAdapter(name, kind, q -> List.of(chunkIds));
  }

  public StubAdapter failingWith(RuntimeException failure) {
    this.failure = failure;
    return this;
  }

  public StubAdapter unavailable() {
    return failingWith(new BackendUnavailableException(name, "connection refused"));
  }

  public StubAdapter delayedBy(long millis) {
    this.delayMillis = millis;
    return this;
  }

  public List<RetrievalQuery> queries() {
    return queries;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public AdapterKind kind() {
    return kind;
  }

  @Override
  public RankedList search(RetrievalQuery query) {
    queries.add(query);
    if (delayMillis > 0) {
      try {
        Thread.sleep(delayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackendUnavailableException(name, "interrupted", e);
      }
    }
    if (failure != null) {
      throw failure;
    }
    List<String> ids = ranking.apply(query);
    List<ScoredResult> results = new ArrayList<>();
    for (int i = 0; i < Math.min(ids.size(), query.k()); i++) {
      double normalised = 1.0 / (i + 1);
      results.add(
          new ScoredResult(
              ids.get(i),
              normalised * 10,
              normalised,
              i + 1,
              new ResultSource(name, kind, query.subQueryIndex())));
    }
    return new RankedList(name, kind, results);
  }

  @Override
  public void index(List<Chunk> chunks) {}

  @Override
  public void removeDocument(String sourceDocumentId) {}
}
