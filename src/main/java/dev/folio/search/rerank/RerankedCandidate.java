package dev.folio.search.rerank;

import org.jspecify.annotations.Nullable;

/**
 * A reranker decision.
 *
 * @param chunkId the chunk
 * @param score the cross-encoder score, or null when the reranker was skipped
 * @param originalRank 1-based position in the input
 * @param finalRank 1-based position in the output
 */
public record RerankedCandidate(
    String chunkId, @Nullable Double score, int originalRank, int finalRank) {}
