package com.flamingo.ai.flowbridge.service.css;

/**
 * A raw declaration inside a rule body.
 *
 * @param property property name as written, trimmed
 * @param value value as written, trimmed
 */
public record CssDeclaration(String property, String value) {

  public String toCss() {
    return property + ": " + value + ";";
  }
}
