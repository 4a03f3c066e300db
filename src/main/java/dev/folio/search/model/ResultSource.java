package dev.folio.search.model;

import org.jspecify.annotations.Nullable;

/**
 * Provenance of a scored result: which adapter produced it and, under decomposition, for which
 * sub-query.
 *
 * @param adapterName the adapter (and ranked list) name
 * @param adapterKind semantic or lexical
 * @param subQueryIndex index of the sub-query in decomposition order, or null when not decomposed
 */
public record ResultSource(
    String adapterName, AdapterKind adapterKind, @Nullable Integer subQueryIndex) {}
