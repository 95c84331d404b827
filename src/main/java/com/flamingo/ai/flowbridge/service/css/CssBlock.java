package com.flamingo.ai.flowbridge.service.css;

import java.util.List;
import java.util.Locale;

/**
 * One top-level (or nested) block of a stylesheet.
 *
 * @param kind block kind
 * @param prelude selector list or at-rule prelude, trimmed
 * @param body text between the braces, or {@code null} for statement at-rules such as
 *     {@code @import}
 * @param text full source text of the block
 * @param children nested blocks for grouping at-rules ({@code @media}, {@code @supports})
 */
public record CssBlock(
    Kind kind, String prelude, String body, String text, List<CssBlock> children) {

  public CssBlock {
    children = children == null ? List.of() : List.copyOf(children);
  }

  /** Block kinds the pipeline distinguishes. */
  public enum Kind {
    STYLE_RULE,
    MEDIA,
    KEYFRAMES,
    FONT_FACE,
    AT_RULE
  }

  /** Lower-cased at-rule name without the {@code @}, or empty for style rules. */
  public String atRuleName() {
    if (!prelude.startsWith("@")) {
      return "";
    }
    int end = 1;
    while (end < prelude.length()
        && (Character.isLetterOrDigit(prelude.charAt(end)) || prelude.charAt(end) == '-')) {
      end++;
    }
    return prelude.substring(1, end).toLowerCase(Locale.ROOT);
  }

  /** At-rule condition text, e.g. the media query of an {@code @media} block. */
  public String condition() {
    String name = atRuleName();
    return name.isEmpty() ? "" : prelude.substring(name.length() + 1).trim();
  }
}
