package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which path produced a section's document. */
public enum ConversionSource {
  GENERATED,
  DETERMINISTIC;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
