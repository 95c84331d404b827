package com.flamingo.ai.flowbridge.service.routing;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.service.css.CssBlock;
import com.flamingo.ai.flowbridge.service.css.CssDeclaration;
import com.flamingo.ai.flowbridge.service.css.CssRuleScanner;
import com.flamingo.ai.flowbridge.service.style.StyleValueParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides, rule by rule, which CSS becomes native style properties and which is carried as raw
 * CSS in an embed. The decisions recorded here are the ones the graph builder follows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CssRoutingTracer {

  static final String STANDARD_PROPERTY = "Standard property - native";

  private static final Pattern PSEUDO_ELEMENT =
      Pattern.compile(
          "::[\\w-]+|(?<!:):(?:before|after|first-line|first-letter)(?![\\w-])",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern PSEUDO_CLASS = Pattern.compile("(?<!:):([\\w-]+)(\\()?");
  private static final Pattern CLASS_CHAIN =
      Pattern.compile("^((?:\\.-?[_a-zA-Z][\\w-]*)+)(.*)$");
  private static final Pattern LEADING_TAG = Pattern.compile("^([a-zA-Z][a-zA-Z0-9]*|\\*)");
  private static final Pattern IMPORTANT =
      Pattern.compile("\\s*!\\s*important\\s*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern PARENTHESIZED = Pattern.compile("\\([^()]*\\)");

  private static final List<String> VENDOR_PREFIXES = List.of("-webkit-", "-moz-", "-ms-", "-o-");
  private static final List<String> UNSUPPORTED_FUNCTIONS =
      List.of("env(", "attr(", "image-set(", "color-mix(", "cross-fade(", "element(", "paint(");

  private final FlowbridgeConfig config;
  private final CssRuleScanner cssRuleScanner;
  private final BreakpointMapper breakpointMapper;

  /**
   * Traces every rule of a stylesheet. Selector lists are expanded so that each selector gets
   * its own entry.
   *
   * @param css stylesheet text
   * @return the trace; empty for blank input
   */
  public RoutingTrace trace(String css) {
    List<RoutedRule> rules = new ArrayList<>();
    for (CssBlock block : cssRuleScanner.scan(css)) {
      traceBlock(block, null, Optional.empty(), rules);
    }
    RoutingTrace trace = RoutingTrace.of(rules);
    log.debug(
        "Routed {} rules: {} native, {} embed, {} split",
        trace.summary().totalRules(),
        trace.summary().nativeRules(),
        trace.summary().embedRules(),
        trace.summary().splitRules());
    return trace;
  }

  // ---- private helpers ----

  private void traceBlock(
      CssBlock block, String media, Optional<BreakpointMapping> mapping, List<RoutedRule> rules) {
    switch (block.kind()) {
      case STYLE_RULE -> {
        for (String selector : CssRuleScanner.splitSelectors(block.prelude())) {
          rules.add(routeRule(nextId(rules), selector, block, media, mapping));
        }
      }
      case MEDIA -> {
        String condition = block.condition();
        Optional<BreakpointMapping> inner = breakpointMapper.map(condition);
        for (CssBlock child : block.children()) {
          traceBlock(child, condition, inner, rules);
        }
      }
      default -> rules.add(routeAtRule(nextId(rules), block, media));
    }
  }

  private static String nextId(List<RoutedRule> rules) {
    return "rule-" + rules.size();
  }

  private RoutedRule routeAtRule(String id, CssBlock block, String media) {
    String name = block.atRuleName();
    return new RoutedRule(
        id,
        block.prelude(),
        media,
        block.text(),
        RouteDestination.EMBED,
        RuleCategory.AT_RULE,
        List.of("At-rule (@" + name + ") requires embed"),
        List.of(),
        null,
        List.of(),
        null,
        null,
        wrap(block.text(), media));
  }

  private RoutedRule routeRule(
      String id,
      String selector,
      CssBlock block,
      String media,
      Optional<BreakpointMapping> mapping) {
    List<CssDeclaration> declarations = CssRuleScanner.parseDeclarations(block.body());
    List<String> reasons = new ArrayList<>();

    if (isRootSelector(selector)) {
      reasons.add("CSS custom properties (:root) - moved to embed");
      return embedRule(id, selector, block, media, RuleCategory.ROOT, reasons, declarations);
    }

    SelectorShape shape = classify(selector);
    if (shape.embedReason() != null) {
      reasons.add(shape.embedReason());
      RuleCategory category = media != null ? RuleCategory.MEDIA : shape.category();
      return embedRule(id, selector, block, media, category, reasons, declarations);
    }

    RuleCategory category = media != null ? RuleCategory.MEDIA : shape.category();
    BreakpointMapping breakpoint = null;
    if (media != null) {
      if (mapping.isEmpty()) {
        reasons.add("Non-standard breakpoint (" + media + ") - moved to embed");
        return embedRule(id, selector, block, media, category, reasons, declarations);
      }
      breakpoint = mapping.get();
      reasons.add("Breakpoint mapped: " + breakpoint.original() + " → " + breakpoint.mapped());
    }
    reasons.add(shape.nativeReason());

    List<RoutedProperty> properties = new ArrayList<>();
    for (CssDeclaration declaration : declarations) {
      properties.add(routeProperty(declaration));
    }
    List<RoutedProperty> nativeProperties =
        properties.stream().filter(RoutedProperty::isNative).toList();
    List<RoutedProperty> embedProperties =
        properties.stream().filter(p -> !p.isNative()).toList();

    RouteDestination destination;
    if (embedProperties.isEmpty()) {
      destination = RouteDestination.NATIVE;
    } else if (nativeProperties.isEmpty()) {
      destination = RouteDestination.EMBED;
    } else {
      destination = RouteDestination.SPLIT;
    }
    embedProperties.stream().map(RoutedProperty::reason).distinct().forEach(reasons::add);

    String nativeOutput =
        nativeProperties.isEmpty() && destination == RouteDestination.EMBED
            ? null
            : nativeProperties.stream()
                .map(p -> p.property() + ": " + p.value() + ";")
                .collect(Collectors.joining(" "));
    String embedOutput =
        embedProperties.isEmpty()
            ? null
            : wrap(selector + " { " + declarationsCss(embedProperties) + " }", media);

    return new RoutedRule(
        id,
        selector,
        media,
        block.text(),
        destination,
        category,
        reasons,
        properties,
        breakpoint,
        shape.classChain(),
        shape.state(),
        nativeOutput,
        embedOutput);
  }

  private RoutedRule embedRule(
      String id,
      String selector,
      CssBlock block,
      String media,
      RuleCategory category,
      List<String> reasons,
      List<CssDeclaration> declarations) {
    List<RoutedProperty> properties =
        declarations.stream()
            .map(
                d ->
                    new RoutedProperty(
                        d.property(), d.value(), RouteDestination.EMBED, reasons.get(0), null))
            .toList();
    String css = selector + " { " + block.body().trim() + " }";
    return new RoutedRule(
        id,
        selector,
        media,
        block.text(),
        RouteDestination.EMBED,
        category,
        reasons,
        properties,
        null,
        List.of(),
        null,
        null,
        wrap(css, media));
  }

  private RoutedProperty routeProperty(CssDeclaration declaration) {
    String property = declaration.property().trim().toLowerCase(Locale.ROOT);
    String value = declaration.value().trim();

    if (property.startsWith("--")) {
      return embedProperty(declaration, "CSS variable requires embed");
    }
    for (String prefix : VENDOR_PREFIXES) {
      if (property.startsWith(prefix)) {
        return embedProperty(declaration, "Vendor prefix (" + prefix + ") requires embed");
      }
    }
    if (StyleValueParser.isUnsupported(property)) {
      return embedProperty(declaration, "Unsupported property (" + property + ") requires embed");
    }
    String lowerValue = value.toLowerCase(Locale.ROOT);
    for (String function : UNSUPPORTED_FUNCTIONS) {
      if (lowerValue.contains(function)) {
        return embedProperty(
            declaration, "Unsupported function (" + function + ") requires embed");
      }
    }

    PropertyTransform transform = null;
    String canonical = StyleValueParser.canonicalName(property);
    if (!canonical.equals(property)) {
      transform = new PropertyTransform(property, canonical, "Property alias");
      property = canonical;
    }
    if (IMPORTANT.matcher(value).find()) {
      String stripped = IMPORTANT.matcher(value).replaceAll("");
      transform = new PropertyTransform(value, stripped, "Removed !important flag");
      value = stripped;
    }
    return new RoutedProperty(
        property, value, RouteDestination.NATIVE, STANDARD_PROPERTY, transform);
  }

  private static RoutedProperty embedProperty(CssDeclaration declaration, String reason) {
    return new RoutedProperty(
        declaration.property().trim(),
        declaration.value().trim(),
        RouteDestination.EMBED,
        reason,
        null);
  }

  private boolean isRootSelector(String selector) {
    String alternate = config.getTokens().getAlternateRootSelector();
    return selector.startsWith(":root")
        || (alternate != null && !alternate.isBlank() && selector.equals(alternate));
  }

  /** What a single selector means to the native style system. */
  private record SelectorShape(
      RuleCategory category,
      String embedReason,
      String nativeReason,
      List<String> classChain,
      String state) {

    static SelectorShape embed(RuleCategory category, String reason) {
      return new SelectorShape(category, reason, null, List.of(), null);
    }
  }

  private SelectorShape classify(String selector) {
    Matcher pseudoElement = PSEUDO_ELEMENT.matcher(selector);
    if (pseudoElement.find()) {
      return SelectorShape.embed(
          RuleCategory.PSEUDO, "Pseudo-element (" + pseudoElement.group() + ") requires embed");
    }
    if (selector.contains("[")) {
      String attribute = selector.substring(selector.indexOf('[') + 1).replaceAll("\\].*$", "");
      return SelectorShape.embed(
          RuleCategory.ATTRIBUTE, "Attribute selector (" + attribute + ") requires embed");
    }

    String flat = flatten(selector);
    for (String combinator : List.of(">", "+", "~")) {
      if (flat.contains(combinator)) {
        return SelectorShape.embed(
            RuleCategory.COMBINATOR, "Combinator (" + combinator + ") requires embed");
      }
    }
    if (flat.trim().contains(" ")) {
      return SelectorShape.embed(
          RuleCategory.COMBINATOR, "Descendant selector (.parent .child) requires embed");
    }
    if (flat.contains("#")) {
      return SelectorShape.embed(RuleCategory.BASE, "ID selector requires embed");
    }
    Matcher tag = LEADING_TAG.matcher(selector);
    if (tag.find()) {
      return SelectorShape.embed(
          RuleCategory.BASE, "Tag selector (" + tag.group(1) + ") requires embed");
    }

    Matcher chain = CLASS_CHAIN.matcher(selector);
    if (!chain.matches()) {
      return SelectorShape.embed(RuleCategory.BASE, "Unrecognized selector requires embed");
    }
    List<String> classes = new ArrayList<>(CssRuleScanner.classNames(chain.group(1)));
    String pseudoPart = chain.group(2);

    String state = null;
    if (!pseudoPart.isEmpty()) {
      Matcher pseudo = PSEUDO_CLASS.matcher(pseudoPart);
      List<String> pseudoClasses = new ArrayList<>();
      boolean hasArguments = false;
      while (pseudo.find()) {
        pseudoClasses.add(pseudo.group(1).toLowerCase(Locale.ROOT));
        hasArguments |= pseudo.group(2) != null;
      }
      Map<String, String> variants = config.getStyle().getPseudoClassVariants();
      boolean supported =
          pseudoClasses.size() == 1 && !hasArguments && variants.containsKey(pseudoClasses.get(0));
      if (!supported) {
        String label = pseudoClasses.isEmpty() ? pseudoPart : ":" + pseudoClasses.get(0);
        return SelectorShape.embed(
            RuleCategory.PSEUDO, "Complex pseudo-class (" + label + ") requires embed");
      }
      state = variants.get(pseudoClasses.get(0));
    }

    if (classes.size() > 1) {
      return new SelectorShape(
          RuleCategory.COMBINATOR,
          null,
          "Compound selector (.a.b) maps to a combo class",
          classes,
          state);
    }
    if (state != null) {
      return new SelectorShape(
          RuleCategory.PSEUDO, null, "State (" + state + ") supported natively", classes, state);
    }
    return new SelectorShape(RuleCategory.BASE, null, STANDARD_PROPERTY, classes, null);
  }

  /** Selector text with parenthesized arguments removed, so nested selectors do not count. */
  private static String flatten(String selector) {
    String flat = selector;
    String previous;
    do {
      previous = flat;
      flat = PARENTHESIZED.matcher(flat).replaceAll("");
    } while (!flat.equals(previous));
    return flat;
  }

  private static String declarationsCss(List<RoutedProperty> properties) {
    return properties.stream()
        .map(p -> p.property() + ": " + p.value() + ";")
        .collect(Collectors.joining(" "));
  }

  private static String wrap(String css, String media) {
    return media == null ? css : "@media " + media + " { " + css + " }";
  }
}
