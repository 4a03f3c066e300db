package dev.folio.search.rerank;

import dev.folio.search.fusion.FusionService;
import dev.folio.search.model.QueryDeadline;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking service that re-scores candidates with an ONNX-based scoring model
 * (ms-marco-MiniLM-L-6-v2).
 *
 * <p>Scores each query-passage pair, then orders by score descending; equal scores keep their
 * input order. The model is optional: when it is absent, throws, returns the wrong number of
 * scores or misses the deadline, the input order is returned unchanged, truncated to {@code topK}.
 * The output is always a subset of the input.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  private final Optional<ScoringModel> scoringModel;
  private final Executor executor;

  public RerankerService(
      Optional<ScoringModel> scoringModel, @Qualifier("retrievalExecutor") Executor executor) {
    this.scoringModel = scoringModel;
    this.executor = executor;
  }

  public boolean isAvailable() {
    return scoringModel.isPresent();
  }

  /**
   * Reorders candidates by cross-encoder relevance.
   *
   * @param query the original query text
   * @param candidates the candidates in their current order
   * @param topK maximum number of ids to return
   * @return chunk ids in the new order
   */
  public List<String> rerank(String query, List<RerankCandidate> candidates, int topK) {
    return rerankWithScores(query, candidates, topK, null, QueryDeadline.none()).stream()
        .map(RerankedCandidate::chunkId)
        .toList();
  }

  /**
   * Reorders candidates by cross-encoder relevance, reporting the scores.
   *
   * @param query the original query text
   * @param candidates the candidates in their current order, unique by chunk id
   * @param topK maximum number of results
   * @param minScore drop scored candidates below this threshold (nullable; ignored when the
   *     reranker is skipped)
   * @param deadline bound on the model call
   * @return reranked candidates; scores are null when the input order was kept
   * @throws IllegalArgumentException on duplicate chunk ids or {@code topK < 1}
   */
  public List<RerankedCandidate> rerankWithScores(
      String query,
      List<RerankCandidate> candidates,
      int topK,
      @Nullable Double minScore,
      QueryDeadline deadline) {
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1, got " + topK);
    }
    Set<String> ids = new HashSet<>();
    for (RerankCandidate candidate : candidates) {
      if (!ids.add(candidate.chunkId())) {
        throw new IllegalArgumentException("Duplicate rerank candidate " + candidate.chunkId());
      }
    }
    if (candidates.isEmpty()) {
      return List.of();
    }
    if (scoringModel.isEmpty()) {
      return inputOrder(candidates, topK);
    }

    List<Double> scores = score(scoringModel.get(), query, candidates, deadline);
    if (scores == null) {
      return inputOrder(candidates, topK);
    }

    List<RerankedCandidate> scored =
        IntStream.range(0, candidates.size())
            .boxed()
            .filter(i -> minScore == null || scores.get(i) >= minScore)
            .sorted(Comparator.comparingDouble((Integer i) -> scores.get(i)).reversed())
            .limit(topK)
            .map(i -> new RerankedCandidate(candidates.get(i).chunkId(), scores.get(i), i + 1, 0))
            .toList();

    List<RerankedCandidate> ranked = new ArrayList<>(scored.size());
    for (int i = 0; i < scored.size(); i++) {
      RerankedCandidate c = scored.get(i);
      ranked.add(new RerankedCandidate(c.chunkId(), c.score(), c.originalRank(), i + 1));
    }
    return ranked;
  }

  private @Nullable List<Double> score(
      ScoringModel model, String query, List<RerankCandidate> candidates, QueryDeadline deadline) {
    List<TextSegment> segments =
        candidates.stream().map(c -> TextSegment.from(c.text())).toList();
    try {
      Response<List<Double>> response =
          deadline
              .bound(CompletableFuture.supplyAsync(() -> model.scoreAll(segments, query), executor))
              .join();
      List<Double> scores = response == null ? null : response.content();
      if (scores == null || scores.size() != candidates.size()) {
        log.warn(
            "Reranker returned {} scores for {} candidates, keeping input order",
            scores == null ? 0 : scores.size(),
            candidates.size());
        return null;
      }
      if (scores.stream().anyMatch(s -> s == null || s.isNaN())) {
        log.warn("Reranker returned invalid scores, keeping input order");
        return null;
      }
      return scores;
    } catch (RuntimeException e) {
      log.warn(
          "Reranker unavailable, keeping input order: {}", FusionService.unwrap(e).toString());
      return null;
    }
  }

  private static List<RerankedCandidate> inputOrder(List<RerankCandidate> candidates, int topK) {
    List<RerankedCandidate> kept = new ArrayList<>();
    for (int i = 0; i < Math.min(topK, candidates.size()); i++) {
      kept.add(new RerankedCandidate(candidates.get(i).chunkId(), null, i + 1, i + 1));
    }
    return kept;
  }
}
