package com.flamingo.ai.flowbridge.service.graph;

import java.util.Locale;

/**
 * Sequential node identifiers of the form {@code <prefix>-<base>-<NNN>}. One instance per
 * document, so identifiers are unique within it.
 */
class IdGenerator {

  private final String prefix;
  private int counter;

  IdGenerator(String prefix) {
    this.prefix = prefix;
  }

  String next(String base) {
    counter++;
    return String.format(Locale.ROOT, "%s-%s-%03d", prefix, sanitize(base), counter);
  }

  private static String sanitize(String base) {
    if (base == null) {
      return "node";
    }
    String clean = base.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]+", "-");
    clean = clean.replaceAll("^-+|-+$", "");
    return clean.isEmpty() ? "node" : clean;
  }
}
