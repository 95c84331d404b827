package com.flamingo.ai.flowbridge.service.token;

import com.flamingo.ai.flowbridge.service.css.CssBlock;
import com.flamingo.ai.flowbridge.service.css.CssDeclaration;
import com.flamingo.ai.flowbridge.service.css.CssRuleScanner;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the font families a page depends on and classifies each as google, system, adobe or
 * custom.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FontDetector {

  static final String GOOGLE_CSS2_BASE = "https://fonts.googleapis.com/css2";

  private static final Pattern GOOGLE_LEGACY =
      Pattern.compile("fonts\\.googleapis\\.com/css\\?family=([^\"'&)\\s>]+)");
  private static final Pattern GOOGLE_CSS2 =
      Pattern.compile("fonts\\.googleapis\\.com/css2\\?([^\"')\\s>]+)");
  private static final Pattern CSS2_FAMILY = Pattern.compile("family=([^&]+)");
  private static final Pattern TYPEKIT = Pattern.compile("use\\.typekit\\.net/([\\w-]+)\\.css");
  private static final Pattern FONT_FAMILY_DECL =
      Pattern.compile("font-family\\s*:\\s*([^;}\"']*(?:[\"'][^\"']*[\"'][^;}\"']*)*)");
  private static final Pattern URL = Pattern.compile("url\\(\\s*[\"']?([^\"')]+)[\"']?\\s*\\)");

  private static final Set<String> SYSTEM_FONTS =
      lowerCased(
          "Arial",
          "Helvetica",
          "Times New Roman",
          "Times",
          "Courier New",
          "Courier",
          "Verdana",
          "Georgia",
          "Palatino",
          "Garamond",
          "Bookman",
          "Comic Sans MS",
          "Trebuchet MS",
          "Impact",
          "sans-serif",
          "serif",
          "monospace",
          "cursive",
          "fantasy",
          "system-ui",
          "-apple-system",
          "inherit");

  private static final Set<String> GOOGLE_FONTS =
      lowerCased(
          "Roboto",
          "Open Sans",
          "Lato",
          "Montserrat",
          "Oswald",
          "Source Sans Pro",
          "Raleway",
          "PT Sans",
          "Merriweather",
          "Nunito",
          "Poppins",
          "Inter",
          "Playfair Display",
          "Ubuntu",
          "Rubik",
          "Work Sans",
          "Mukta",
          "Noto Sans",
          "Fira Sans",
          "Quicksand",
          "DM Sans",
          "Space Grotesk",
          "Manrope");

  private final CssRuleScanner cssRuleScanner;

  /**
   * Detects fonts in page markup and/or CSS.
   *
   * @param source full page markup or a bare stylesheet
   * @return detected fonts, checklist and summary
   */
  public FontReport detect(String source) {
    if (source == null || source.isBlank()) {
      return new FontReport(List.of(), List.of(), "No fonts detected");
    }
    Map<String, FontAccumulator> fonts = new LinkedHashMap<>();

    detectGoogleImports(source, fonts);
    detectTypekit(source, fonts);
    detectFontFaces(source, fonts);
    detectDeclarations(source, fonts);

    List<DetectedFont> detected = fonts.values().stream().map(FontAccumulator::toFont).toList();
    List<FontReport.ChecklistItem> checklist =
        detected.stream().map(this::toChecklistItem).toList();
    log.debug("Detected {} font families", detected.size());
    return new FontReport(detected, checklist, summarize(detected));
  }

  /** Builds the manifest font section: families plus a Google Fonts stylesheet when needed. */
  public TokenFonts toTokenFonts(FontReport report) {
    List<String> families = report.fonts().stream().map(DetectedFont::family).toList();
    List<DetectedFont> google =
        report.fonts().stream().filter(f -> f.source() == FontSource.GOOGLE).toList();
    if (google.isEmpty()) {
      return new TokenFonts(families, "", "");
    }
    String query =
        google.stream()
            .map(
                f -> {
                  String family = "family=" + f.family().replace(' ', '+');
                  return f.weights().isEmpty()
                      ? family
                      : family + ":wght@" + String.join(";", f.weights());
                })
            .collect(Collectors.joining("&"));
    String url = GOOGLE_CSS2_BASE + "?" + query + "&display=swap";
    String snippet =
        "<link rel=\"preconnect\" href=\"https://fonts.googleapis.com\">\n"
            + "<link rel=\"preconnect\" href=\"https://fonts.gstatic.com\" crossorigin>\n"
            + "<link href=\""
            + url
            + "\" rel=\"stylesheet\">";
    return new TokenFonts(families, url, snippet);
  }

  // ---- detection passes ----

  private void detectGoogleImports(String source, Map<String, FontAccumulator> fonts) {
    Matcher legacy = GOOGLE_LEGACY.matcher(source);
    while (legacy.find()) {
      String url = "https://fonts.googleapis.com/css?family=" + legacy.group(1);
      for (String familyEntry : decode(legacy.group(1)).split("\\|")) {
        String[] parts = familyEntry.split(":", 2);
        FontAccumulator font = accumulator(fonts, parts[0], FontSource.GOOGLE, url);
        if (parts.length > 1) {
          for (String variant : parts[1].split(",")) {
            addLegacyVariant(font, variant.trim());
          }
        }
      }
    }

    Matcher css2 = GOOGLE_CSS2.matcher(source);
    while (css2.find()) {
      String url = GOOGLE_CSS2_BASE + "?" + css2.group(1);
      Matcher family = CSS2_FAMILY.matcher(css2.group(1));
      while (family.find()) {
        String familyEntry = decode(family.group(1));
        String[] parts = familyEntry.split(":", 2);
        FontAccumulator font = accumulator(fonts, parts[0], FontSource.GOOGLE, url);
        if (parts.length > 1) {
          addCss2Axes(font, parts[1]);
        }
      }
    }
  }

  private void detectTypekit(String source, Map<String, FontAccumulator> fonts) {
    Matcher typekit = TYPEKIT.matcher(source);
    while (typekit.find()) {
      String url = "https://use.typekit.net/" + typekit.group(1) + ".css";
      accumulator(fonts, "Adobe Fonts (" + typekit.group(1) + ")", FontSource.ADOBE, url);
    }
  }

  private void detectFontFaces(String source, Map<String, FontAccumulator> fonts) {
    for (CssBlock block : cssRuleScanner.scan(CssRuleScanner.stylesheetOf(source))) {
      if (block.kind() != CssBlock.Kind.FONT_FACE) {
        continue;
      }
      String family = null;
      String weight = null;
      String style = null;
      String url = "";
      for (CssDeclaration declaration : CssRuleScanner.parseDeclarations(block.body())) {
        switch (declaration.property().toLowerCase(Locale.ROOT)) {
          case "font-family" -> family = unquote(declaration.value());
          case "font-weight" -> weight = declaration.value();
          case "font-style" -> style = declaration.value();
          case "src" -> {
            Matcher matcher = URL.matcher(declaration.value());
            if (matcher.find()) {
              url = matcher.group(1);
            }
          }
          default -> log.debug("Ignoring @font-face descriptor {}", declaration.property());
        }
      }
      if (family == null || family.isBlank()) {
        continue;
      }
      FontAccumulator font = accumulator(fonts, family, FontSource.CUSTOM, url);
      if (weight != null) {
        font.weights.add(weight);
      }
      if (style != null) {
        font.styles.add(style);
      }
    }
  }

  private void detectDeclarations(String source, Map<String, FontAccumulator> fonts) {
    Matcher declaration = FONT_FAMILY_DECL.matcher(CssRuleScanner.stylesheetOf(source));
    while (declaration.find()) {
      for (String candidate : declaration.group(1).split(",")) {
        String family = unquote(candidate.trim());
        if (family.isEmpty() || family.startsWith("var(")) {
          continue;
        }
        String key = family.toLowerCase(Locale.ROOT);
        if (SYSTEM_FONTS.contains(key)) {
          accumulator(fonts, family, FontSource.SYSTEM, "");
        } else if (GOOGLE_FONTS.contains(key)) {
          accumulator(
              fonts,
              family,
              FontSource.GOOGLE,
              GOOGLE_CSS2_BASE + "?family=" + family.replace(' ', '+'));
        } else {
          accumulator(fonts, family, FontSource.CUSTOM, "");
        }
      }
    }
  }

  // ---- private helpers ----

  private FontAccumulator accumulator(
      Map<String, FontAccumulator> fonts, String family, FontSource source, String url) {
    String name = family.replace('+', ' ').trim();
    return fonts.computeIfAbsent(
        name.toLowerCase(Locale.ROOT), key -> new FontAccumulator(name, source, url));
  }

  private static void addLegacyVariant(FontAccumulator font, String variant) {
    if (variant.isEmpty()) {
      return;
    }
    boolean italic = variant.endsWith("italic") || variant.endsWith("i");
    String weight = variant.replaceAll("[^0-9]", "");
    font.weights.add(weight.isEmpty() ? "400" : weight);
    font.styles.add(italic ? "italic" : "normal");
  }

  private static void addCss2Axes(FontAccumulator font, String axes) {
    // e.g. "wght@400;700" or "ital,wght@0,400;1,700"
    String[] parts = axes.split("@", 2);
    if (parts.length < 2) {
      return;
    }
    List<String> axisNames = List.of(parts[0].split(","));
    int italIndex = axisNames.indexOf("ital");
    int wghtIndex = axisNames.indexOf("wght");
    for (String tuple : parts[1].split(";")) {
      String[] values = tuple.split(",");
      if (wghtIndex >= 0 && wghtIndex < values.length) {
        font.weights.add(values[wghtIndex].trim());
      }
      boolean italic = italIndex >= 0 && italIndex < values.length && "1".equals(values[italIndex]);
      font.styles.add(italic ? "italic" : "normal");
    }
  }

  private FontReport.ChecklistItem toChecklistItem(DetectedFont font) {
    return switch (font.source()) {
      case GOOGLE -> new FontReport.ChecklistItem(
          font.family(),
          font.source(),
          FontReport.Status.AVAILABLE,
          "Enable in site settings from Google Fonts");
      case SYSTEM -> new FontReport.ChecklistItem(
          font.family(), font.source(), FontReport.Status.AVAILABLE, "No action needed");
      case ADOBE -> new FontReport.ChecklistItem(
          font.family(), font.source(), FontReport.Status.MISSING, "Connect the Adobe Fonts kit");
      case CUSTOM -> new FontReport.ChecklistItem(
          font.family(), font.source(), FontReport.Status.MISSING, "Upload the font files");
    };
  }

  private static String summarize(List<DetectedFont> fonts) {
    if (fonts.isEmpty()) {
      return "No fonts detected";
    }
    Map<FontSource, Long> counts =
        fonts.stream().collect(Collectors.groupingBy(DetectedFont::source, Collectors.counting()));
    long missing = fonts.stream().filter(f -> !f.compatible()).count();
    return String.format(
        "%d font%s detected: %d Google, %d system, %d custom, %d Adobe (%d need setup)",
        fonts.size(),
        fonts.size() == 1 ? "" : "s",
        counts.getOrDefault(FontSource.GOOGLE, 0L),
        counts.getOrDefault(FontSource.SYSTEM, 0L),
        counts.getOrDefault(FontSource.CUSTOM, 0L),
        counts.getOrDefault(FontSource.ADOBE, 0L),
        missing);
  }

  private static String unquote(String value) {
    String trimmed = value.trim();
    if (trimmed.length() >= 2
        && (trimmed.startsWith("\"") && trimmed.endsWith("\"")
            || trimmed.startsWith("'") && trimmed.endsWith("'"))) {
      return trimmed.substring(1, trimmed.length() - 1).trim();
    }
    return trimmed;
  }

  private static String decode(String value) {
    return URLDecoder.decode(value.replace("+", "%20"), StandardCharsets.UTF_8);
  }

  private static Set<String> lowerCased(String... names) {
    Set<String> set = new HashSet<>();
    for (String name : names) {
      set.add(name.toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(set);
  }

  private static final class FontAccumulator {
    private final String family;
    private final FontSource source;
    private final String url;
    private final Set<String> weights = new TreeSet<>();
    private final Set<String> styles = new TreeSet<>();

    private FontAccumulator(String family, FontSource source, String url) {
      this.family = family;
      this.source = source;
      this.url = url;
    }

    private DetectedFont toFont() {
      boolean compatible = source == FontSource.GOOGLE || source == FontSource.SYSTEM;
      return new DetectedFont(
          family, source, url, new ArrayList<>(weights), new ArrayList<>(styles), compatible);
    }
  }
}
