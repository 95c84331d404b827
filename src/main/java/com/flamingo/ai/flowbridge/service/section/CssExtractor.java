package com.flamingo.ai.flowbridge.service.section;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.service.css.CssBlock;
import com.flamingo.ai.flowbridge.service.css.CssDeclaration;
import com.flamingo.ai.flowbridge.service.css.CssRuleScanner;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Pulls the subset of a page stylesheet that applies to one section. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CssExtractor {

  private static final Pattern BARE_TAG = Pattern.compile("^[a-zA-Z][a-zA-Z0-9]*$");
  private static final Set<String> BASE_TAGS = Set.of("body", "html", "img");
  private static final Set<String> ANIMATION_KEYWORDS =
      Set.of(
          "none", "infinite", "linear", "ease", "ease-in", "ease-out", "ease-in-out", "forwards",
          "backwards", "both", "alternate", "alternate-reverse", "normal", "reverse", "running",
          "paused", "step-start", "step-end", "initial", "inherit");

  private final FlowbridgeConfig config;
  private final CssRuleScanner cssRuleScanner;

  /**
   * Extracts the CSS a section needs.
   *
   * @param stylesheet full page stylesheet
   * @param sectionHtml the section's markup, used to decide which bare-tag rules apply
   * @param classNames class names referenced by the section
   * @param options base-rule toggles
   * @return matching rule texts joined by blank lines, in pull order
   */
  public String extract(
      String stylesheet,
      String sectionHtml,
      Collection<String> classNames,
      CssExtractionOptions options) {
    List<CssBlock> blocks = cssRuleScanner.scan(stylesheet);
    if (blocks.isEmpty()) {
      return "";
    }
    Set<String> classes = new HashSet<>(classNames);
    Set<String> sectionTags = tagsIn(sectionHtml);
    Collection<String> pulled = options.dedupe() ? new LinkedHashSet<>() : new ArrayList<>();

    for (CssBlock block : styleRules(blocks)) {
      if (includeBaseRule(block, options)) {
        pulled.add(block.text());
      }
    }
    for (CssBlock block : styleRules(blocks)) {
      if (referencesAny(block, classes) || isMatchingTagGroup(block, sectionTags)) {
        pulled.add(block.text());
      }
    }
    for (CssBlock block : blocks) {
      if (block.kind() == CssBlock.Kind.MEDIA
          || (block.kind() == CssBlock.Kind.AT_RULE && !block.children().isEmpty())) {
        String rebuilt = rebuildGroup(block, classes);
        if (rebuilt != null) {
          pulled.add(rebuilt);
        }
      }
    }
    if (options.includeKeyframes()) {
      Set<String> animations = animationNames(pulled);
      for (CssBlock block : blocks) {
        if (block.kind() == CssBlock.Kind.KEYFRAMES
            && animations.contains(keyframesName(block))) {
          pulled.add(block.text());
        }
      }
    }
    Set<String> families = fontFamilies(pulled);
    for (CssBlock block : blocks) {
      if (block.kind() == CssBlock.Kind.FONT_FACE && families.contains(fontFaceFamily(block))) {
        pulled.add(block.text());
      }
    }

    log.debug("Extracted {} CSS blocks for {} classes", pulled.size(), classes.size());
    return String.join("\n\n", pulled);
  }

  // ---- private helpers ----

  private static List<CssBlock> styleRules(List<CssBlock> blocks) {
    return blocks.stream().filter(b -> b.kind() == CssBlock.Kind.STYLE_RULE).toList();
  }

  private boolean includeBaseRule(CssBlock block, CssExtractionOptions options) {
    List<String> selectors = CssRuleScanner.splitSelectors(block.prelude());
    if (selectors.isEmpty()) {
      return false;
    }
    if (options.includeRoot() && selectors.stream().allMatch(this::isRootSelector)) {
      return true;
    }
    if (options.includeReset() && selectors.stream().allMatch(s -> s.startsWith("*"))) {
      return true;
    }
    if (selectors.size() != 1) {
      return false;
    }
    String selector = selectors.get(0).toLowerCase(Locale.ROOT);
    return (options.includeBody() && selector.equals("body"))
        || (options.includeHtml() && selector.equals("html"))
        || (options.includeImg() && selector.equals("img"));
  }

  private boolean isRootSelector(String selector) {
    String alternate = config.getTokens().getAlternateRootSelector();
    return selector.equals(":root")
        || (alternate != null && !alternate.isBlank() && selector.equals(alternate));
  }

  private static boolean referencesAny(CssBlock rule, Set<String> classes) {
    for (String selector : CssRuleScanner.splitSelectors(rule.prelude())) {
      for (String name : CssRuleScanner.classNames(selector)) {
        if (classes.contains(name)) {
          return true;
        }
      }
    }
    return false;
  }

  /** A selector list made only of bare tags, at least one of which the section uses. */
  private static boolean isMatchingTagGroup(CssBlock rule, Set<String> sectionTags) {
    List<String> selectors = CssRuleScanner.splitSelectors(rule.prelude());
    if (selectors.isEmpty()
        || !selectors.stream().allMatch(s -> BARE_TAG.matcher(s).matches())) {
      return false;
    }
    List<String> tags = selectors.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    if (tags.size() == 1 && BASE_TAGS.contains(tags.get(0))) {
      return false;
    }
    return tags.stream().anyMatch(sectionTags::contains);
  }

  /** The grouping block restricted to the inner rules that match, or null when none do. */
  private static String rebuildGroup(CssBlock group, Set<String> classes) {
    List<String> inner = new ArrayList<>();
    for (CssBlock child : group.children()) {
      if (child.kind() == CssBlock.Kind.STYLE_RULE && referencesAny(child, classes)) {
        inner.add("  " + child.text());
      } else if (!child.children().isEmpty()) {
        String nested = rebuildGroup(child, classes);
        if (nested != null) {
          inner.add("  " + nested);
        }
      }
    }
    if (inner.isEmpty()) {
      return null;
    }
    return group.prelude() + " {\n" + String.join("\n", inner) + "\n}";
  }

  private Set<String> animationNames(Collection<String> pulled) {
    Set<String> names = new HashSet<>();
    for (CssDeclaration declaration : declarationsOf(pulled)) {
      String property = declaration.property().toLowerCase(Locale.ROOT);
      if (!property.equals("animation") && !property.equals("animation-name")) {
        continue;
      }
      for (String animation : declaration.value().split(",")) {
        for (String token : animation.trim().split("\\s+")) {
          if (!token.isEmpty()
              && !ANIMATION_KEYWORDS.contains(token.toLowerCase(Locale.ROOT))
              && !Character.isDigit(token.charAt(0))
              && !token.startsWith(".")
              && !token.contains("(")) {
            names.add(token);
          }
        }
      }
    }
    return names;
  }

  private Set<String> fontFamilies(Collection<String> pulled) {
    Set<String> families = new HashSet<>();
    for (CssDeclaration declaration : declarationsOf(pulled)) {
      if (declaration.property().equalsIgnoreCase("font-family")) {
        for (String family : declaration.value().split(",")) {
          families.add(normalizeFamily(family));
        }
      }
    }
    return families;
  }

  private List<CssDeclaration> declarationsOf(Collection<String> pulled) {
    List<CssDeclaration> declarations = new ArrayList<>();
    collectDeclarations(cssRuleScanner.scan(String.join("\n", pulled)), declarations);
    return declarations;
  }

  private static void collectDeclarations(List<CssBlock> blocks, List<CssDeclaration> into) {
    for (CssBlock block : blocks) {
      if (block.kind() == CssBlock.Kind.STYLE_RULE) {
        into.addAll(CssRuleScanner.parseDeclarations(block.body()));
      } else {
        collectDeclarations(block.children(), into);
      }
    }
  }

  private static String keyframesName(CssBlock block) {
    String prelude = block.prelude().trim();
    int space = prelude.indexOf(' ');
    return space < 0 ? "" : prelude.substring(space + 1).trim();
  }

  private static String fontFaceFamily(CssBlock block) {
    for (CssDeclaration declaration : CssRuleScanner.parseDeclarations(block.body())) {
      if (declaration.property().equalsIgnoreCase("font-family")) {
        return normalizeFamily(declaration.value());
      }
    }
    return "";
  }

  private static String normalizeFamily(String family) {
    return family.trim().replaceAll("^['\"]|['\"]$", "").toLowerCase(Locale.ROOT);
  }

  private static Set<String> tagsIn(String html) {
    Set<String> tags = new HashSet<>();
    if (html == null) {
      return tags;
    }
    Element body = Jsoup.parseBodyFragment(html).body();
    for (Element element : body.getAllElements()) {
      if (element != body) {
        tags.add(element.normalName());
      }
    }
    return tags;
  }
}
