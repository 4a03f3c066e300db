package dev.folio.search;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.folio.search.model.AdapterKind;

/** Which adapters a search consults. */
public enum SearchMode {
  /** Every configured adapter, fused with RRF. */
  HYBRID("hybrid"),
  /** Vector adapters only. */
  SEMANTIC("semantic"),
  /** Lexical adapters only. */
  KEYWORD("keyword");

  private final String value;

  SearchMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  boolean includes(AdapterKind kind) {
    return switch (this) {
      case HYBRID -> true;
      case SEMANTIC -> kind == AdapterKind.SEMANTIC;
      case KEYWORD -> kind == AdapterKind.LEXICAL;
    };
  }
}
