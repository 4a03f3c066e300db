package dev.folio.search;

import dev.folio.search.model.ScoredResult;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Domain DTO for one search hit with citation data and provenance.
 *
 * @param chunkId the matched chunk
 * @param text the chunk text
 * @param sourceDocumentId the document the chunk belongs to
 * @param position ordinal of the chunk within its document
 * @param metadata the chunk metadata
 * @param score the aggregated RRF score
 * @param combinedScore weighted sum of the best semantic and lexical normalised scores, in [0, 1]
 * @param rerankScore the cross-encoder score (null if not reranked)
 * @param matchedSubQueries indices of the sub-queries that found the chunk
 * @param provenance the adapter hits behind the result
 */
public record SearchResult(
    String chunkId,
    String text,
    String sourceDocumentId,
    int position,
    Map<String, Object> metadata,
    double score,
    double combinedScore,
    @Nullable Double rerankScore,
    List<Integer> matchedSubQueries,
    List<ScoredResult> provenance) {

  public SearchResult {
    metadata = Map.copyOf(metadata);
    matchedSubQueries = List.copyOf(matchedSubQueries);
    provenance = List.copyOf(provenance);
  }
}
