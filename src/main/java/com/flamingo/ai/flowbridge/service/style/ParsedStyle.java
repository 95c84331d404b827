package com.flamingo.ai.flowbridge.service.style;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of parsing an inline style string.
 *
 * @param properties surviving pairs in source order
 * @param warnings one entry per dropped or rewritten declaration
 */
public record ParsedStyle(List<StyleProperty> properties, List<String> warnings) {

  public ParsedStyle {
    properties = List.copyOf(properties);
    warnings = List.copyOf(warnings);
  }

  /** Property map; later declarations of the same property win. */
  public Map<String, String> asMap() {
    Map<String, String> map = new LinkedHashMap<>();
    properties.forEach(p -> map.put(p.property(), p.value()));
    return map;
  }

  public boolean isEmpty() {
    return properties.isEmpty();
  }
}
