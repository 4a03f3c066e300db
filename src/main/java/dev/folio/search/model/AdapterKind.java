package dev.folio.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of signal a retrieval adapter contributes to fusion. */
public enum AdapterKind {
  SEMANTIC("semantic"),
  LEXICAL("lexical");

  private final String value;

  AdapterKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
