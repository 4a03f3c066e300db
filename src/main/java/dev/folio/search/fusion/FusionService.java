package dev.folio.search.fusion;

import dev.folio.exception.BackendUnavailableException;
import dev.folio.exception.NoSearchableBackendException;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.QueryDeadline;
import dev.folio.search.model.RankedList;
import dev.folio.search.model.RetrievalAdapter;
import dev.folio.search.model.RetrievalQuery;
import dev.folio.search.vector.QueryEmbedder;
import dev.langchain4j.data.embedding.Embedding;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one query against a set of adapters in parallel and merges their lists with {@link
 * ReciprocalRankFusion}.
 *
 * <p>The query embedding is computed once and shared by every semantic adapter. Each adapter call
 * is bounded by the query deadline. An adapter that times out or raises {@link
 * BackendUnavailableException} contributes nothing; any other failure, notably a configuration
 * error, fails the whole query. Nothing here blocks a pool thread.
 */
@Service
public class FusionService {

  private static final Logger log = LoggerFactory.getLogger(FusionService.class);

  private final QueryEmbedder queryEmbedder;
  private final Executor executor;

  public FusionService(
      QueryEmbedder queryEmbedder, @Qualifier("retrievalExecutor") Executor executor) {
    this.queryEmbedder = queryEmbedder;
    this.executor = executor;
  }

  /**
   * Searches the given adapters and fuses the answers.
   *
   * @param query the query; its embedding is filled in here when semantic adapters are selected
   * @param adapters adapters to query, in a stable order
   * @param rrfK the RRF smoothing constant
   * @param deadline bound on every adapter call
   * @return a future of the fused outcome, failed with {@link NoSearchableBackendException} when no
   *     adapter answered
   */
  public CompletableFuture<FusionOutcome> search(
      RetrievalQuery query, List<RetrievalAdapter> adapters, int rrfK, QueryDeadline deadline) {
    ReciprocalRankFusion.requireValidK(rrfK);
    if (adapters.isEmpty()) {
      return CompletableFuture.failedFuture(new NoSearchableBackendException(List.of()));
    }

    CompletableFuture<Embedding> embedding = null;
    if (adapters.stream().anyMatch(a -> a.kind() == AdapterKind.SEMANTIC)) {
      embedding = embed(query);
    }

    List<CompletableFuture<AdapterAnswer>> answers = new ArrayList<>(adapters.size());
    for (RetrievalAdapter adapter : adapters) {
      answers.add(call(adapter, query, embedding, deadline));
    }

    return CompletableFuture.allOf(answers.toArray(new CompletableFuture[0]))
        .thenApply(ignored -> combine(adapters, answers, rrfK));
  }

  private CompletableFuture<Embedding> embed(RetrievalQuery query) {
    Embedding provided = query.embedding();
    if (provided != null) {
      return CompletableFuture.completedFuture(provided);
    }
    return supplyAsync(() -> queryEmbedder.embed(query.text()));
  }

  private CompletableFuture<AdapterAnswer> call(
      RetrievalAdapter adapter,
      RetrievalQuery query,
      @Nullable CompletableFuture<Embedding> embedding,
      QueryDeadline deadline) {
    CompletableFuture<RankedList> call;
    if (adapter.kind() == AdapterKind.SEMANTIC && embedding != null) {
      call = embedding.thenApplyAsync(e -> adapter.search(query.withEmbedding(e)), executor);
    } else {
      call = supplyAsync(() -> adapter.search(query));
    }
    return deadline.bound(call).handle((list, error) -> answer(adapter, list, error));
  }

  private <T> CompletableFuture<T> supplyAsync(Supplier<T> supplier) {
    try {
      return CompletableFuture.supplyAsync(supplier, executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private AdapterAnswer answer(
      RetrievalAdapter adapter, @Nullable RankedList list, @Nullable Throwable error) {
    if (error == null) {
      return new AdapterAnswer(adapter.name(), list);
    }
    Throwable cause = unwrap(error);
    if (cause instanceof BackendUnavailableException
        || cause instanceof TimeoutException
        || cause instanceof RejectedExecutionException) {
      log.warn(
          "Adapter {} unavailable, continuing without it: {}", adapter.name(), cause.toString());
      return new AdapterAnswer(adapter.name(), null);
    }
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    throw new CompletionException(cause);
  }

  private FusionOutcome combine(
      List<RetrievalAdapter> adapters, List<CompletableFuture<AdapterAnswer>> answers, int rrfK) {
    List<RankedList> lists = new ArrayList<>();
    List<String> contributing = new ArrayList<>();
    List<String> unavailable = new ArrayList<>();
    for (CompletableFuture<AdapterAnswer> future : answers) {
      AdapterAnswer answer = future.join();
      if (answer.list() == null) {
        unavailable.add(answer.adapterName());
      } else {
        lists.add(answer.list());
        contributing.add(answer.adapterName());
      }
    }
    if (contributing.isEmpty()) {
      throw new NoSearchableBackendException(
          adapters.stream().map(RetrievalAdapter::name).toList());
    }
    List<FusedResult> fused = ReciprocalRankFusion.fuse(lists, rrfK);
    log.debug(
        "Fused {} lists into {} results (unavailable: {})",
        lists.size(),
        fused.size(),
        unavailable);
    return new FusionOutcome(fused, contributing, unavailable);
  }

  /** Strips the wrappers {@link CompletableFuture} adds around a failure. */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private record AdapterAnswer(String adapterName, @Nullable RankedList list) {}
}
