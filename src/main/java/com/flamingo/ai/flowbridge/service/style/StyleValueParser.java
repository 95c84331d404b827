package com.flamingo.ai.flowbridge.service.style;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parser for the inline {@code prop: value;} syntax used by style strings.
 *
 * <p>The parser is total: malformed declarations are dropped one by one and reported as warnings,
 * never thrown.
 */
@Component
@Slf4j
public class StyleValueParser {

  private static final Pattern PROPERTY_NAME = Pattern.compile("^[a-zA-Z_-][a-zA-Z0-9_-]*$");
  private static final Pattern IMPORTANT =
      Pattern.compile("\\s*!\\s*important\\s*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*$");
  private static final Pattern TRAILING_OPEN_PAREN = Pattern.compile("\\(\\s*$");
  private static final Pattern TRAILING_OPERATOR = Pattern.compile("[+\\-*/]\\s*$");
  private static final Pattern TRAILING_NUMBER_IN_FUNCTION =
      Pattern.compile("(?:rgba?|hsla?|calc|var|url)\\([^)]*$", Pattern.CASE_INSENSITIVE);

  private static final Set<String> EMPTY_LIKE = Set.of("", "undefined", "null", "NaN");

  /** Properties the consumer rejects; dropped without a warning. */
  private static final Set<String> UNSUPPORTED =
      Set.of(
          "-moz-appearance",
          "-ms-overflow-style",
          "-o-transform",
          "scroll-behavior",
          "scroll-snap-type",
          "scroll-snap-align",
          "isolation",
          "container-type",
          "container-name");

  private static final Map<String, String> ALIASES =
      Map.of(
          "row-gap", "grid-row-gap",
          "column-gap", "grid-column-gap",
          "gap", "grid-gap");

  /**
   * Parses an inline style string.
   *
   * @param styleLess semicolon-delimited declarations, no braces
   * @return surviving pairs plus warnings for everything dropped
   */
  public ParsedStyle parse(String styleLess) {
    List<StyleProperty> properties = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    if (styleLess == null || styleLess.isBlank()) {
      return new ParsedStyle(properties, warnings);
    }

    for (String rawSegment : styleLess.split(";")) {
      String segment = rawSegment.trim();
      if (segment.isEmpty()) {
        continue;
      }
      parseDeclaration(segment, warnings).ifPresent(properties::add);
    }
    return new ParsedStyle(properties, warnings);
  }

  /** Property map view of {@link #parse(String)}; warnings are discarded. */
  public Map<String, String> toMap(String styleLess) {
    return parse(styleLess).asMap();
  }

  /** Serializes pairs back to inline syntax. */
  public String toStyleLess(Collection<StyleProperty> properties) {
    return properties.stream().map(StyleProperty::toDeclaration).collect(Collectors.joining(" "));
  }

  public String toStyleLess(Map<String, String> properties) {
    return properties.entrySet().stream()
        .map(e -> e.getKey() + ": " + e.getValue() + ";")
        .collect(Collectors.joining(" "));
  }

  /** True when every declaration survives parsing unchanged in meaning. */
  public boolean isValid(String styleLess) {
    return parse(styleLess).warnings().isEmpty();
  }

  /** Drops every invalid declaration and re-serializes the rest. */
  public String sanitize(String styleLess) {
    return toStyleLess(parse(styleLess).properties());
  }

  /**
   * Merges two inline strings; properties in {@code override} replace those in {@code base}.
   *
   * @return merged inline string
   */
  public String merge(String base, String override) {
    Map<String, String> merged = toMap(base);
    merged.putAll(toMap(override));
    return toStyleLess(merged);
  }

  /** True for properties the consumer rejects outright. */
  public static boolean isUnsupported(String property) {
    return UNSUPPORTED.contains(property.toLowerCase(Locale.ROOT));
  }

  /** The accepted spelling of a property name. */
  public static String canonicalName(String property) {
    String name = property.toLowerCase(Locale.ROOT);
    return ALIASES.getOrDefault(name, name);
  }

  // ---- private helpers ----

  private Optional<StyleProperty> parseDeclaration(String segment, List<String> warnings) {
    int colon = segment.indexOf(':');
    if (colon < 0) {
      warnings.add("Skipped invalid declaration (no colon): \"" + segment + "\"");
      return Optional.empty();
    }

    String rawName = segment.substring(0, colon).trim();
    if (!PROPERTY_NAME.matcher(rawName).matches()) {
      warnings.add("Skipped invalid property name: \"" + rawName + "\"");
      return Optional.empty();
    }

    String name = rawName.toLowerCase(Locale.ROOT);
    if (name.startsWith("--")) {
      log.debug("Dropping custom property declaration: {}", name);
      return Optional.empty();
    }
    if (UNSUPPORTED.contains(name)) {
      log.debug("Dropping unsupported property: {}", name);
      return Optional.empty();
    }
    name = ALIASES.getOrDefault(name, name);

    String value = segment.substring(colon + 1).trim();
    if (IMPORTANT.matcher(value).find()) {
      value = IMPORTANT.matcher(value).replaceAll("");
      warnings.add("Removed !important flag from \"" + name + "\"");
    }
    if (value.contains("var(--")) {
      warnings.add("Skipped unresolved CSS variable in \"" + name + "\": \"" + value + "\"");
      return Optional.empty();
    }
    value = WHITESPACE.matcher(value).replaceAll(" ").trim();

    if (EMPTY_LIKE.contains(value)) {
      warnings.add("Skipped empty value for property: \"" + name + "\"");
      return Optional.empty();
    }
    if (isTruncated(value)) {
      warnings.add("Skipped truncated value for \"" + name + "\": \"" + value + "\"");
      return Optional.empty();
    }
    return Optional.of(new StyleProperty(name, value));
  }

  /**
   * A value is truncated when it ends mid-expression or its parentheses or quotes do not balance.
   */
  static boolean isTruncated(String value) {
    if (TRAILING_COMMA.matcher(value).find()
        || TRAILING_OPEN_PAREN.matcher(value).find()
        || TRAILING_OPERATOR.matcher(value).find()
        || TRAILING_NUMBER_IN_FUNCTION.matcher(value).find()) {
      return true;
    }
    int parens = 0;
    int singleQuotes = 0;
    int doubleQuotes = 0;
    for (char c : value.toCharArray()) {
      if (c == '(') {
        parens++;
      } else if (c == ')') {
        parens--;
      } else if (c == '\'') {
        singleQuotes++;
      } else if (c == '"') {
        doubleQuotes++;
      }
    }
    return parens != 0 || singleQuotes % 2 != 0 || doubleQuotes % 2 != 0;
  }
}
