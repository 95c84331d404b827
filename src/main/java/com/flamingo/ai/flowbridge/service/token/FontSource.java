package com.flamingo.ai.flowbridge.service.token;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Where a font family comes from. */
public enum FontSource {
  GOOGLE,
  SYSTEM,
  ADOBE,
  CUSTOM;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
