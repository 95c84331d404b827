package com.flamingo.ai.flowbridge.service.graph;

import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import com.flamingo.ai.flowbridge.service.token.TokenVariable;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Substitutes {@code var(--name[, fallback])} references with concrete values: the manifest's
 * default-mode value when the variable is known, else the fallback. References with neither are
 * left in place for the style parser to drop.
 */
@Component
@Slf4j
public class VariableResolver {

  private static final String VAR_OPEN = "var(";
  private static final int MAX_DEPTH = 8;

  public String resolve(String value, TokenManifest manifest) {
    return resolve(value, manifest, 0);
  }

  // ---- private helpers ----

  private String resolve(String value, TokenManifest manifest, int depth) {
    if (value == null || !value.contains(VAR_OPEN) || depth > MAX_DEPTH) {
      return value;
    }
    StringBuilder out = new StringBuilder();
    int position = 0;
    while (position < value.length()) {
      int start = value.indexOf(VAR_OPEN, position);
      if (start < 0) {
        out.append(value, position, value.length());
        break;
      }
      int close = closingParen(value, start + VAR_OPEN.length() - 1);
      if (close < 0) {
        out.append(value, position, value.length());
        break;
      }
      out.append(value, position, start);
      String reference = value.substring(start, close + 1);
      out.append(resolveReference(reference, manifest, depth));
      position = close + 1;
    }
    return out.toString();
  }

  private String resolveReference(String reference, TokenManifest manifest, int depth) {
    String inner = reference.substring(VAR_OPEN.length(), reference.length() - 1);
    int comma = topLevelComma(inner);
    String name = (comma < 0 ? inner : inner.substring(0, comma)).trim();
    String fallback = comma < 0 ? null : inner.substring(comma + 1).trim();

    Optional<String> known =
        manifest == null ? Optional.empty() : manifest.find(name).map(TokenVariable::defaultValue);
    if (known.isPresent()) {
      return resolve(known.get(), manifest, depth + 1);
    }
    if (fallback != null && !fallback.isEmpty()) {
      return resolve(fallback, manifest, depth + 1);
    }
    log.debug("Unresolved CSS variable {}", name);
    return reference;
  }

  private static int closingParen(String text, int open) {
    int depth = 0;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static int topLevelComma(String text) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        return i;
      }
    }
    return -1;
  }
}
