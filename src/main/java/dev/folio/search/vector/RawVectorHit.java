package dev.folio.search.vector;

/**
 * A hit as returned by a backend, before normalisation.
 *
 * @param chunkId the matched chunk
 * @param rawScore the backend-native similarity or distance
 */
public record RawVectorHit(String chunkId, double rawScore) {}
