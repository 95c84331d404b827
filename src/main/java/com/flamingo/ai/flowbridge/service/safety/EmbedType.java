package com.flamingo.ai.flowbridge.service.safety;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kinds of raw embed, each budgeted on its own. */
public enum EmbedType {
  HTML("HTML"),
  CSS("CSS"),
  JS("JS");

  private final String displayName;

  EmbedType(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
