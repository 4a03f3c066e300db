package dev.folio.search.decompose;

import java.util.List;

/** Splits a complex query into simpler sub-queries that are retrieved independently. */
public interface QueryDecomposer {

  /**
   * Decomposes a query.
   *
   * @param query the user query, possibly blank
   * @return at least one sub-query, in decomposition order; the whole query when nothing applies
   */
  List<SubQuery> decompose(String query);
}
