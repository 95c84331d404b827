package com.flamingo.ai.flowbridge.service.routing;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Where a rule or declaration ends up. */
public enum RouteDestination {
  /** Expressible as a style property. */
  NATIVE,
  /** Carried as raw CSS in an embed. */
  EMBED,
  /** Some declarations native, the rest embedded. */
  SPLIT;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
