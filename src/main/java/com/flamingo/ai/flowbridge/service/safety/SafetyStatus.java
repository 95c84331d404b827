package com.flamingo.ai.flowbridge.service.safety;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Overall gate verdict. */
public enum SafetyStatus {
  OK,
  WARN,
  BLOCK;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
