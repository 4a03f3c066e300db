package dev.folio.search.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered output of one adapter for one query. Ranks start at 1 and increase by one per entry;
 * chunk ids are unique.
 *
 * @param listId identifier of the list (the producing adapter's name)
 * @param adapterKind kind of the producing adapter
 * @param results hits in rank order
 */
public record RankedList(String listId, AdapterKind adapterKind, List<ScoredResult> results) {

  public RankedList {
    results = List.copyOf(results);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < results.size(); i++) {
      ScoredResult result = results.get(i);
      if (result.rank() != i + 1) {
        throw new IllegalArgumentException(
            "Ranked list " + listId + " expected rank " + (i + 1) + " but got " + result.rank());
      }
      if (!seen.add(result.chunkId())) {
        throw new IllegalArgumentException(
            "Ranked list " + listId + " contains duplicate chunk " + result.chunkId());
      }
    }
  }

  public static RankedList empty(String listId, AdapterKind adapterKind) {
    return new RankedList(listId, adapterKind, List.of());
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }

  public int size() {
    return results.size();
  }
}
