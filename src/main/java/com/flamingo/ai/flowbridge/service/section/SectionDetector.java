package com.flamingo.ai.flowbridge.service.section;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.service.css.CssRuleScanner;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Splits a full page into sections.
 *
 * <p>Detection runs in passes over the page body. Marker comments claim the element that follows
 * them, then a sweep claims the remaining semantic elements, then (when enabled) container divs
 * whose leading class looks like a section. An element overlapping one already claimed is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionDetector {

  static final String UNTITLED_PAGE = "Untitled";
  static final String UNTITLED_SECTION = "Untitled Section";

  private static final Pattern BODY =
      Pattern.compile("<body[^>]*>(.*)</body>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern MARKER =
      Pattern.compile(
          "<!--\\s*((?:(?!-->).)+?)\\s*-->\\s*"
              + "(?=<(?:section|nav|header|footer|main|aside|article|div)(?![\\w-]))",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern SEMANTIC_OPEN =
      Pattern.compile("<(?:section|nav|header|footer)(?![\\w-])", Pattern.CASE_INSENSITIVE);
  private static final Pattern DIV_OPEN =
      Pattern.compile("<div(?![\\w-])", Pattern.CASE_INSENSITIVE);

  private final FlowbridgeConfig config;
  private final CssExtractor cssExtractor;

  /** Detects sections using the configured extraction defaults. */
  public SectionDetectionResult detect(String html) {
    return detect(html, CssExtractionOptions.from(config.getExtraction()));
  }

  /**
   * Detects sections and extracts each one's CSS subset.
   *
   * @param html full page markup
   * @param options base-rule inclusion toggles for CSS extraction
   * @return sections in source order; an empty list when nothing matches
   */
  public SectionDetectionResult detect(String html, CssExtractionOptions options) {
    String page = html == null ? "" : html;
    Document document = Jsoup.parse(page);
    String title = extractTitle(document);
    String stylesheet = CssRuleScanner.styleElements(page);
    List<String> scripts = extractScripts(document);
    String body = extractBody(page);

    List<Claim> claims = new ArrayList<>();
    claimMarked(body, claims);
    claimMatching(body, SEMANTIC_OPEN, element -> true, claims);
    if (config.getSection().isImplicitDetectionEnabled()) {
      claimMatching(body, DIV_OPEN, this::isImplicitSection, claims);
    }
    claims.sort(Comparator.comparingInt(claim -> claim.element().start()));

    Set<String> usedIds = new HashSet<>();
    List<Section> sections = new ArrayList<>();
    for (Claim claim : claims) {
      sections.add(toSection(body, claim, stylesheet, options, usedIds));
    }
    log.debug("Detected {} sections in page '{}'", sections.size(), title);
    return new SectionDetectionResult(title, sections, stylesheet, scripts);
  }

  /** Display name for a class, id or marker text. */
  public static String formatSectionName(String input) {
    if (input == null) {
      return UNTITLED_SECTION;
    }
    String name =
        input
            .trim()
            .replaceAll("(?i)-section$", "")
            .replaceAll("(?i)section$", "")
            .replace('-', ' ')
            .replace('_', ' ');
    String formatted =
        Arrays.stream(name.split("\\s+"))
            .filter(word -> !word.isEmpty())
            .map(
                word ->
                    word.substring(0, 1).toUpperCase(Locale.ROOT)
                        + word.substring(1).toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
    return formatted.isEmpty() ? UNTITLED_SECTION : formatted;
  }

  // ---- private helpers ----

  private record Claim(ElementScanner.Element element, String name) {}

  private void claimMarked(String body, List<Claim> claims) {
    Matcher marker = MARKER.matcher(body);
    while (marker.find()) {
      int start = marker.end();
      if (isClaimed(start, claims)) {
        continue;
      }
      Optional<ElementScanner.Element> element = ElementScanner.elementAt(body, start);
      if (element.isEmpty()) {
        log.debug("Skipping marked element with no closing tag: {}", marker.group(1));
        continue;
      }
      if (!overlaps(element.get(), claims)) {
        claims.add(new Claim(element.get(), marker.group(1).trim()));
      }
    }
  }

  private void claimMatching(
      String body, Pattern openTag, Predicate<ElementScanner.Element> accept, List<Claim> claims) {
    Matcher open = openTag.matcher(body);
    while (open.find()) {
      if (isClaimed(open.start(), claims)) {
        continue;
      }
      Optional<ElementScanner.Element> element = ElementScanner.elementAt(body, open.start());
      if (element.isEmpty()) {
        log.debug("Skipping unbalanced element at offset {}", open.start());
        continue;
      }
      if (accept.test(element.get()) && !overlaps(element.get(), claims)) {
        ElementScanner.Element found = element.get();
        String name = firstNonEmpty(found.firstClass(), found.id(), found.tag());
        claims.add(new Claim(found, name));
      }
    }
  }

  private boolean isImplicitSection(ElementScanner.Element element) {
    String leading = element.firstClass();
    if (leading.isEmpty()) {
      return false;
    }
    FlowbridgeConfig.Section section = config.getSection();
    return leading.matches(section.getImplicitClassPattern())
        || section.getImplicitClassNames().contains(leading);
  }

  private Section toSection(
      String body,
      Claim claim,
      String stylesheet,
      CssExtractionOptions options,
      Set<String> usedIds) {
    ElementScanner.Element element = claim.element();
    String html = element.html(body).trim();
    String className = element.firstClass();
    String baseId = sectionId(firstNonEmpty(className, element.id(), claim.name()));
    List<String> classNames = ElementScanner.allClassNames(html);
    String css = cssExtractor.extract(stylesheet, html, classNames, options);
    return new Section(
        uniqueId(baseId, usedIds),
        formatSectionName(claim.name()),
        element.tag(),
        className,
        html,
        classNames,
        css);
  }

  private static boolean isClaimed(int offset, List<Claim> claims) {
    return claims.stream().anyMatch(claim -> claim.element().contains(offset));
  }

  private static boolean overlaps(ElementScanner.Element element, List<Claim> claims) {
    return claims.stream()
        .map(Claim::element)
        .anyMatch(other -> element.start() < other.end() && other.start() < element.end());
  }

  private static String sectionId(String input) {
    String id = input.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    id = id.replaceAll("^-+|-+$", "");
    return id.isEmpty() ? "section" : id;
  }

  private static String uniqueId(String baseId, Set<String> usedIds) {
    String id = baseId;
    int counter = 1;
    while (!usedIds.add(id)) {
      id = baseId + "-" + counter++;
    }
    return id;
  }

  private static String extractTitle(Document document) {
    String title = document.title().trim();
    int dash = title.indexOf(" - ");
    String cut = dash > 0 ? title.substring(0, dash).trim() : title;
    return cut.isEmpty() ? UNTITLED_PAGE : cut;
  }

  private static List<String> extractScripts(Document document) {
    List<String> scripts = new ArrayList<>();
    for (Element script : document.select("script:not([src])")) {
      String content = script.data().trim();
      if (!content.isEmpty()) {
        scripts.add(content);
      }
    }
    return scripts;
  }

  private static String extractBody(String html) {
    Matcher matcher = BODY.matcher(html);
    return matcher.find() ? matcher.group(1) : html;
  }

  private static String firstNonEmpty(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate;
      }
    }
    return "";
  }
}
