package com.flamingo.ai.flowbridge.service.style;

/**
 * A validated property/value pair in inline style syntax.
 *
 * @param property lower-cased property name
 * @param value normalized value
 */
public record StyleProperty(String property, String value) {

  public String toDeclaration() {
    return property + ": " + value + ";";
  }
}
