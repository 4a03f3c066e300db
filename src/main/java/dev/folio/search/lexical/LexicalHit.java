package dev.folio.search.lexical;

/**
 * One BM25 match.
 *
 * @param chunkId the matched chunk
 * @param score the raw BM25 score, always positive
 */
public record LexicalHit(String chunkId, double score) {}
