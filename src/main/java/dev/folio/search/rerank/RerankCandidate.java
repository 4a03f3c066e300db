package dev.folio.search.rerank;

/**
 * A chunk offered to the reranker.
 *
 * @param chunkId the chunk
 * @param text the passage scored against the query
 */
public record RerankCandidate(String chunkId, String text) {}
