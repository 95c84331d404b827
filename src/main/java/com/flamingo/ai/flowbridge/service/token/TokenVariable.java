package com.flamingo.ai.flowbridge.service.token;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named design value.
 *
 * @param path display path, e.g. {@code Colors / Background / Card}
 * @param cssVar custom property name including the leading {@code --}
 * @param type token kind
 * @param values value per mode, in mode order
 */
public record TokenVariable(
    String path, String cssVar, TokenType type, Map<String, String> values) {

  public TokenVariable {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /** Value of the first mode. */
  public String defaultValue() {
    return values.values().stream().findFirst().orElse("");
  }

  @JsonIgnore
  public boolean isMultiMode() {
    return values.size() > 1;
  }
}
