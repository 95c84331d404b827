package com.flamingo.ai.flowbridge.service.token;

import java.util.List;

/**
 * A font family found in page markup or CSS.
 *
 * @param family family name without quotes
 * @param source origin classification
 * @param url stylesheet or font file URL, empty when unknown
 * @param weights weights in ascending order
 * @param styles font styles (normal, italic)
 * @param compatible whether the destination can load the family without manual setup
 */
public record DetectedFont(
    String family,
    FontSource source,
    String url,
    List<String> weights,
    List<String> styles,
    boolean compatible) {

  public DetectedFont {
    weights = List.copyOf(weights);
    styles = List.copyOf(styles);
  }
}
