package com.flamingo.ai.flowbridge.service.section;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;

/**
 * Locates complete elements in raw markup. Closing tags are matched by counting nested
 * same-tag open/close pairs, so a section holding a nested section is never cut short. Attribute
 * values are read by jsoup, so unquoted and single-quoted values behave like quoted ones.
 */
final class ElementScanner {

  private static final Pattern OPEN_TAG = Pattern.compile("<([a-zA-Z][a-zA-Z0-9-]*)([^>]*)>");

  private ElementScanner() {}

  /** An element's span in its source. {@code end} is exclusive. */
  record Element(String tag, List<String> classes, String id, int start, int end) {

    Element {
      classes = List.copyOf(classes);
    }

    String html(String source) {
      return source.substring(start, end);
    }

    String firstClass() {
      return classes.isEmpty() ? "" : classes.get(0);
    }

    boolean contains(int offset) {
      return offset >= start && offset < end;
    }
  }

  /**
   * Reads the element whose opening tag starts at {@code start}.
   *
   * @return the element, or empty when no opening tag starts there or its close is missing
   */
  static Optional<Element> elementAt(String html, int start) {
    Matcher open = OPEN_TAG.matcher(html);
    if (!open.find(start) || open.start() != start) {
      return Optional.empty();
    }
    String tag = open.group(1).toLowerCase(Locale.ROOT);
    org.jsoup.nodes.Element parsed = openingTag(tag, open.group(2));
    List<String> classes = new ArrayList<>(parsed.classNames());
    String id = parsed.id();
    if (open.group(2).endsWith("/")) {
      return Optional.of(new Element(tag, classes, id, start, open.end()));
    }
    int end = findClose(html, open.end(), tag);
    if (end < 0) {
      return Optional.empty();
    }
    return Optional.of(new Element(tag, classes, id, start, end));
  }

  /**
   * Finds the end of the closing tag that balances an already-open {@code tag}.
   *
   * @param from offset just past the opening tag
   * @return offset just past the balancing close, or -1
   */
  static int findClose(String html, int from, String tag) {
    Pattern tags =
        Pattern.compile(
            "<(/?)" + Pattern.quote(tag) + "(?![\\w-])[^>]*?(/?)>", Pattern.CASE_INSENSITIVE);
    Matcher matcher = tags.matcher(html);
    int depth = 1;
    int position = from;
    while (matcher.find(position)) {
      position = matcher.end();
      if (!matcher.group(1).isEmpty()) {
        depth--;
        if (depth == 0) {
          return matcher.end();
        }
      } else if (matcher.group(2).isEmpty()) {
        depth++;
      }
    }
    return -1;
  }

  /** Every class name used anywhere in a markup slice, in order of first use. */
  static List<String> allClassNames(String html) {
    List<String> names = new ArrayList<>();
    if (html == null || html.isBlank()) {
      return names;
    }
    for (org.jsoup.nodes.Element element : Jsoup.parseBodyFragment(html).select("[class]")) {
      for (String name : element.classNames()) {
        if (!names.contains(name)) {
          names.add(name);
        }
      }
    }
    return names;
  }

  /**
   * Parses a lone opening tag. The tag is rebuilt as a neutral {@code div} so that elements jsoup
   * would relocate, such as {@code body} or {@code head}, still keep their attributes.
   */
  static org.jsoup.nodes.Element openingTag(String tag, String attributes) {
    String attributeText =
        attributes.endsWith("/") ? attributes.substring(0, attributes.length() - 1) : attributes;
    org.jsoup.nodes.Element parsed =
        Jsoup.parseBodyFragment("<div" + attributeText + "></div>").body().children().first();
    return parsed == null ? new org.jsoup.nodes.Element(tag) : parsed;
  }
}
