package dev.folio.search.decompose;

/** Which decomposer produced a sub-query. */
public enum SubQueryOrigin {
  RULE,
  LLM
}
