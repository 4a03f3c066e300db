package dev.folio.search;

import dev.folio.document.Chunk;
import dev.folio.document.ChunkCatalog;
import dev.folio.exception.NoSearchableBackendException;
import dev.folio.search.decompose.AggregatedResult;
import dev.folio.search.decompose.AggregationStrategy;
import dev.folio.search.decompose.QueryDecomposer;
import dev.folio.search.decompose.ResultAggregator;
import dev.folio.search.decompose.SubQuery;
import dev.folio.search.decompose.SubQueryOrigin;
import dev.folio.search.fusion.FusedResult;
import dev.folio.search.fusion.FusionOutcome;
import dev.folio.search.fusion.FusionService;
import dev.folio.search.model.AdapterKind;
import dev.folio.search.model.QueryDeadline;
import dev.folio.search.model.RetrievalAdapter;
import dev.folio.search.model.RetrievalQuery;
import dev.folio.search.model.ScoredResult;
import dev.folio.search.rerank.RerankCandidate;
import dev.folio.search.rerank.RerankedCandidate;
import dev.folio.search.rerank.RerankerService;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer: decompose, fuse per sub-query, aggregate, rerank, resolve.
 *
 * <p>Pipeline: derive the query deadline -> optionally decompose the query -> select adapters by
 * mode -> run one RRF fusion per sub-query concurrently -> aggregate the fused lists -> take the
 * candidate pool and optionally rerank it with the cross-encoder -> resolve chunk text and
 * metadata from the catalog.
 *
 * <p>Sub-query fusions run on the retrieval executor; the only blocking wait is on the calling
 * thread.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  private final List<RetrievalAdapter> adapters;
  private final FusionService fusionService;
  private final QueryDecomposer decomposer;
  private final RerankerService rerankerService;
  private final ChunkCatalog catalog;
  private final SearchProperties properties;
  private final Clock clock;

  public SearchService(
      List<RetrievalAdapter> adapters,
      FusionService fusionService,
      QueryDecomposer decomposer,
      RerankerService rerankerService,
      ChunkCatalog catalog,
      SearchProperties properties,
      Clock clock) {
    this.adapters = List.copyOf(adapters);
    this.fusionService = fusionService;
    this.decomposer = decomposer;
    this.rerankerService = rerankerService;
    this.catalog = catalog;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Runs a search.
   *
   * @param request the search request
   * @return ranked results with provenance
   * @throws NoSearchableBackendException if no adapter serves the mode or every adapter failed
   * @throws dev.folio.exception.ConfigurationException on an invalid RRF constant or a dimension
   *     mismatch
   */
  public SearchResponse search(SearchRequest request) {
    QueryDeadline deadline = QueryDeadline.after(properties.getQueryTimeout(), clock);

    List<RetrievalAdapter> selected =
        adapters.stream().filter(a -> request.mode().includes(a.kind())).toList();
    if (selected.isEmpty()) {
      throw new NoSearchableBackendException(List.of());
    }

    List<SubQuery> subQueries =
        request.decompose()
            ? decomposer.decompose(request.query())
            : List.of(SubQuery.of(request.query(), SubQueryOrigin.RULE));
    int rrfK = request.rrfK() != null ? request.rrfK() : properties.getRrfK();
    AggregationStrategy strategy =
        request.aggregation() != null ? request.aggregation() : properties.aggregationStrategy();
    int fetchK = fetchDepth(request);
    log.debug(
        "Searching '{}' mode={} subQueries={} fetchK={}",
        request.query(),
        request.mode(),
        subQueries.size(),
        fetchK);

    List<CompletableFuture<SubQueryOutcome>> pending = new ArrayList<>(subQueries.size());
    for (int i = 0; i < subQueries.size(); i++) {
      RetrievalQuery query =
          new RetrievalQuery(subQueries.get(i).text(), fetchK, request.filter(), i, null);
      pending.add(
          fusionService
              .search(query, selected, rrfK, deadline)
              .handle(SearchService::toSubQueryOutcome));
    }
    List<SubQueryOutcome> outcomes = awaitAll(pending);

    List<List<FusedResult>> fused = new ArrayList<>(outcomes.size());
    Set<String> unavailable = new LinkedHashSet<>();
    NoSearchableBackendException firstFailure = null;
    for (SubQueryOutcome outcome : outcomes) {
      if (outcome.failure() != null) {
        firstFailure = firstFailure == null ? outcome.failure() : firstFailure;
        unavailable.addAll(outcome.failure().getTriedAdapters());
        fused.add(List.of());
      } else {
        FusionOutcome fusion = outcome.fusion();
        unavailable.addAll(fusion.unavailableAdapters());
        fused.add(fusion.results());
      }
    }
    if (firstFailure != null && outcomes.stream().allMatch(o -> o.failure() != null)) {
      throw firstFailure;
    }

    List<AggregatedResult> aggregated =
        ResultAggregator.aggregate(subQueries, fused, strategy, properties.getWeightedDecay());

    double semanticWeight =
        request.semanticWeight() != null
            ? request.semanticWeight()
            : properties.getSemanticWeight();
    double keywordWeight =
        request.keywordWeight() != null ? request.keywordWeight() : properties.getKeywordWeight();
    Predicate<Resolved> threshold = r -> passesMinScore(r, request.minScore());

    List<SearchResult> results;
    boolean reranked = false;
    if (request.rerank() && rerankerService.isAvailable()) {
      int poolSize = Math.max(request.limit(), properties.getRerankCandidates());
      List<Resolved> pool =
          resolve(aggregated, poolSize, semanticWeight, keywordWeight, r -> true);
      List<RerankedCandidate> order =
          pool.isEmpty()
              ? List.of()
              : rerankerService.rerankWithScores(
                  request.query(),
                  pool.stream()
                      .map(r -> new RerankCandidate(r.chunk().id(), r.chunk().text()))
                      .toList(),
                  request.limit(),
                  request.minScore(),
                  deadline);
      reranked = !pool.isEmpty() && (order.isEmpty() || order.get(0).score() != null);
      Map<String, Resolved> byId = new HashMap<>();
      pool.forEach(r -> byId.put(r.chunk().id(), r));
      boolean scored = reranked;
      results =
          order.stream()
              .filter(c -> scored || threshold.test(byId.get(c.chunkId())))
              .map(c -> toSearchResult(byId.get(c.chunkId()), c.score()))
              .toList();
    } else {
      results =
          resolve(aggregated, request.limit(), semanticWeight, keywordWeight, threshold).stream()
              .map(r -> toSearchResult(r, null))
              .toList();
    }

    log.debug(
        "Search '{}' returned {} results (reranked={}, unavailable={})",
        request.query(),
        results.size(),
        reranked,
        unavailable);
    return new SearchResponse(results, subQueries, List.copyOf(unavailable), reranked);
  }

  /** Hits fetched from every adapter for each sub-query. */
  int fetchDepth(SearchRequest request) {
    long base = (long) request.limit() * properties.getFetchMultiplier();
    if (request.rerank()) {
      base = Math.max(base, properties.getRerankCandidates());
    }
    return (int) Math.min(Integer.MAX_VALUE, base);
  }

  /** Takes up to {@code poolSize} catalogued results that satisfy {@code accept}, in order. */
  private List<Resolved> resolve(
      List<AggregatedResult> aggregated,
      int poolSize,
      double semanticWeight,
      double keywordWeight,
      Predicate<Resolved> accept) {
    List<Resolved> pool = new ArrayList<>(Math.min(poolSize, aggregated.size()));
    for (AggregatedResult result : aggregated) {
      if (pool.size() == poolSize) {
        break;
      }
      Optional<Chunk> chunk = catalog.find(result.chunkId());
      if (chunk.isEmpty()) {
        log.debug("Dropping {}: not in the chunk catalog", result.chunkId());
        continue;
      }
      Resolved resolved =
          new Resolved(
              chunk.get(), result, combinedScore(result, semanticWeight, keywordWeight));
      if (accept.test(resolved)) {
        pool.add(resolved);
      } else {
        log.debug("Dropping {}: below the minimum score", result.chunkId());
      }
    }
    return pool;
  }

  /**
   * Weighted sum of the best normalised semantic and lexical scores behind a result, across
   * sub-queries. A kind that did not find the chunk contributes nothing.
   */
  static double combinedScore(
      AggregatedResult result, double semanticWeight, double keywordWeight) {
    double semantic = 0.0;
    double lexical = 0.0;
    for (ScoredResult hit : result.provenance()) {
      if (hit.source().adapterKind() == AdapterKind.SEMANTIC) {
        semantic = Math.max(semantic, hit.normalisedScore());
      } else {
        lexical = Math.max(lexical, hit.normalisedScore());
      }
    }
    return Math.min(1.0, semanticWeight * semantic + keywordWeight * lexical);
  }

  /** A result is kept unless both its combined and its fused score fall below the threshold. */
  private static boolean passesMinScore(Resolved resolved, @Nullable Double minScore) {
    return minScore == null
        || resolved.combinedScore() >= minScore
        || resolved.result().aggregateScore() >= minScore;
  }

  private static SearchResult toSearchResult(Resolved resolved, @Nullable Double rerankScore) {
    Chunk chunk = resolved.chunk();
    AggregatedResult result = resolved.result();
    return new SearchResult(
        chunk.id(),
        chunk.text(),
        chunk.sourceDocumentId(),
        chunk.position(),
        chunk.metadata().toMap(),
        result.aggregateScore(),
        resolved.combinedScore(),
        rerankScore,
        result.matchedSubQueries(),
        result.provenance());
  }

  private static SubQueryOutcome toSubQueryOutcome(
      @Nullable FusionOutcome fusion, @Nullable Throwable error) {
    if (error == null) {
      return new SubQueryOutcome(fusion, null);
    }
    Throwable cause = FusionService.unwrap(error);
    if (cause instanceof NoSearchableBackendException noBackend) {
      return new SubQueryOutcome(null, noBackend);
    }
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    throw new CompletionException(cause);
  }

  private static List<SubQueryOutcome> awaitAll(List<CompletableFuture<SubQueryOutcome>> pending) {
    try {
      CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
    } catch (CompletionException e) {
      Throwable cause = FusionService.unwrap(e);
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
    return pending.stream().map(CompletableFuture::join).toList();
  }

  private record SubQueryOutcome(
      @Nullable FusionOutcome fusion, @Nullable NoSearchableBackendException failure) {}

  private record Resolved(Chunk chunk, AggregatedResult result, double combinedScore) {}
}
