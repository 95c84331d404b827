package com.flamingo.ai.flowbridge.service.collision;

import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rewrites {@code var(--token, fallback)} references to destination variable identifiers. A
 * reference without a mapping is left as written.
 */
@Component
public class VariableRemapper {

  private static final Pattern VAR_START = Pattern.compile("var\\(\\s*(--[\\w-]+)\\s*");

  /**
   * Remaps every style of a copy of the document.
   *
   * @param variableIds CSS variable name (with {@code --}) to destination identifier
   * @return the remapped copy
   */
  public XscpDocument remap(XscpDocument document, Map<String, String> variableIds) {
    XscpDocument copy = document.copy();
    if (variableIds == null || variableIds.isEmpty()) {
      return copy;
    }
    for (Style style : copy.getPayload().getStyles()) {
      style.setStyleLess(remap(style.getStyleLess(), variableIds));
      Map<String, Style.Variant> variants = new LinkedHashMap<>();
      style
          .getVariants()
          .forEach(
              (key, variant) ->
                  variants.put(key, new Style.Variant(remap(variant.styleLess(), variableIds))));
      style.setVariants(variants);
    }
    return copy;
  }

  /** Remaps one inline property string. Nested parentheses in fallbacks are kept balanced. */
  public String remap(String styleLess, Map<String, String> variableIds) {
    if (styleLess == null || styleLess.isEmpty() || variableIds == null || variableIds.isEmpty()) {
      return styleLess;
    }
    StringBuilder out = new StringBuilder();
    Matcher matcher = VAR_START.matcher(styleLess);
    int position = 0;
    while (matcher.find(position)) {
      int close = closingParen(styleLess, matcher.end());
      if (close < 0) {
        break;
      }
      String identifier = variableIds.get(matcher.group(1));
      out.append(styleLess, position, matcher.start());
      if (identifier == null) {
        out.append(styleLess, matcher.start(), close + 1);
      } else {
        out.append("var(--").append(identifier).append(')');
      }
      position = close + 1;
    }
    out.append(styleLess.substring(position));
    return out.toString();
  }

  // ---- private helpers ----

  private static int closingParen(String text, int from) {
    int depth = 1;
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }
}
