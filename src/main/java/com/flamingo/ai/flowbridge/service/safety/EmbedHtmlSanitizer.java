package com.flamingo.ai.flowbridge.service.safety;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Cleans markup bound for an HTML embed. Document-level tags are dropped while their content is
 * kept, and inline event handler attributes are removed. Markup needing neither change is returned
 * untouched, so a second run over cleaned markup changes nothing.
 */
final class EmbedHtmlSanitizer {

  private static final Map<String, Pattern> ROOT_TAGS = new LinkedHashMap<>();

  static {
    ROOT_TAGS.put("doctype", Pattern.compile("(?i)<!doctype[^>]*>"));
    ROOT_TAGS.put("html", Pattern.compile("(?i)</?html(?=[\\s>/])"));
    ROOT_TAGS.put("head", Pattern.compile("(?i)</?head(?=[\\s>/])"));
    ROOT_TAGS.put("body", Pattern.compile("(?i)</?body(?=[\\s>/])"));
  }

  /**
   * Result of one sanitation.
   *
   * @param html cleaned markup
   * @param changes applied fixes, empty when the markup was returned as given
   * @param warnings problems left for the author to resolve
   */
  record Sanitized(String html, List<String> changes, List<String> warnings) {

    boolean changed() {
      return !changes.isEmpty();
    }
  }

  Sanitized sanitize(String html) {
    if (html == null || html.isBlank()) {
      return new Sanitized(html, List.of(), List.of());
    }
    List<String> present = rootTagsIn(html);
    Document document = Jsoup.parseBodyFragment(html);
    document.outputSettings().prettyPrint(false);
    int handlers = removeEventHandlers(document.body());

    List<String> changes = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    if (handlers > 0) {
      changes.add("Removed " + handlers + " inline event handler(s)");
      warnings.add("Inline event handlers were removed; recreate them as script listeners");
    }
    if (changes.isEmpty() && present.isEmpty()) {
      return new Sanitized(html, List.of(), List.of());
    }

    String cleaned = document.body().html().trim();
    List<String> remaining = rootTagsIn(cleaned);
    List<String> removed = new ArrayList<>(present);
    removed.removeAll(remaining);
    if (!removed.isEmpty()) {
      changes.add("Removed document-level tags: " + String.join(", ", removed));
    }
    for (String label : remaining) {
      warnings.add("Embed HTML still contains <" + label + "> tag text; remove it manually");
    }
    return changes.isEmpty()
        ? new Sanitized(html, List.of(), warnings)
        : new Sanitized(cleaned, changes, warnings);
  }

  // ---- private helpers ----

  private static List<String> rootTagsIn(String html) {
    List<String> found = new ArrayList<>();
    ROOT_TAGS.forEach(
        (label, pattern) -> {
          if (pattern.matcher(html).find()) {
            found.add(label);
          }
        });
    return found;
  }

  private static int removeEventHandlers(Element root) {
    int removed = 0;
    for (Element element : root.getAllElements()) {
      List<String> handlers = new ArrayList<>();
      for (Attribute attribute : element.attributes()) {
        if (attribute.getKey().toLowerCase(Locale.ROOT).startsWith("on")) {
          handlers.add(attribute.getKey());
        }
      }
      for (String handler : handlers) {
        element.removeAttr(handler);
      }
      removed += handlers.size();
    }
    return removed;
  }
}
