package com.flamingo.ai.flowbridge.service.graph;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.NodeData;
import com.flamingo.ai.flowbridge.domain.xscp.NodeType;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.domain.xscp.XscpPayload;
import com.flamingo.ai.flowbridge.service.routing.CssRoutingTracer;
import com.flamingo.ai.flowbridge.service.routing.RoutedRule;
import com.flamingo.ai.flowbridge.service.routing.RoutingTrace;
import com.flamingo.ai.flowbridge.service.style.ParsedStyle;
import com.flamingo.ai.flowbridge.service.style.StyleValueParser;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Deterministic section converter: walks markup into a flat node list and turns the natively
 * routable CSS into class styles. Never fails; malformed input yields fewer nodes or styles.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NodeStyleGraphBuilder {

  static final String MAIN_BREAKPOINT = "main";

  private static final Set<String> DROPPED_TAGS =
      Set.of(
          "head", "meta", "link", "title", "script", "style", "noscript", "base", "iframe",
          "canvas", "input");
  private static final Set<String> DIV_TAGS =
      Set.of("html", "body", "main", "form", "label", "button");
  private static final Pattern CLASS_PREFIX = Pattern.compile("^([a-z]+)-");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final FlowbridgeConfig config;
  private final CssRoutingTracer cssRoutingTracer;
  private final StyleValueParser styleValueParser;
  private final VariableResolver variableResolver;

  /**
   * Builds a candidate document for one section.
   *
   * @param html section markup
   * @param css the section's CSS subset
   * @param idPrefix node identifier prefix; derived from the first class when blank
   * @param manifest tokens used to resolve variable references, may be null
   * @return the document with its build diagnostics
   */
  public GraphBuildResult build(String html, String css, String idPrefix, TokenManifest manifest) {
    Element body = Jsoup.parseBodyFragment(html == null ? "" : html).body();
    Element root = singleRoot(body);
    IdGenerator ids = new IdGenerator(resolvePrefix(idPrefix, root));

    List<Node> nodes = new ArrayList<>();
    Set<String> usedClasses = new LinkedHashSet<>();
    Node rootNode = emitElement(root, nodes, usedClasses, ids);

    RoutingTrace trace = cssRoutingTracer.trace(css);
    List<String> warnings = new ArrayList<>();
    List<Style> styles = buildStyles(trace, usedClasses, manifest, warnings);

    String embedCss = trace.embedCss();
    if (!embedCss.isBlank() && rootNode != null) {
      Node embed = embedNode(ids.next("embed"), "<style>\n" + embedCss + "\n</style>");
      nodes.add(embed);
      rootNode.getChildren().add(embed.getId());
    }

    XscpDocument document =
        XscpDocument.builder()
            .payload(XscpPayload.builder().nodes(nodes).styles(styles).build())
            .build();
    log.debug(
        "Built {} nodes and {} styles ({} warnings)", nodes.size(), styles.size(), warnings.size());
    return new GraphBuildResult(document, warnings, trace, embedCss);
  }

  // ---- private helpers ----

  private static Element singleRoot(Element body) {
    List<Element> kept =
        body.children().stream()
            .filter(child -> !DROPPED_TAGS.contains(child.normalName()))
            .toList();
    boolean looseText = body.textNodes().stream().anyMatch(text -> !text.isBlank());
    return kept.size() == 1 && !looseText ? kept.get(0) : body;
  }

  private String resolvePrefix(String idPrefix, Element root) {
    if (idPrefix != null && !idPrefix.isBlank()) {
      return idPrefix.trim();
    }
    String firstClass = root.classNames().stream().findFirst().orElse("");
    Matcher matcher = CLASS_PREFIX.matcher(firstClass);
    if (matcher.find()) {
      return matcher.group(1);
    }
    return config.getGeneration().getDefaultIdPrefix();
  }

  /** Emits an element and its subtree in pre-order. Returns null for dropped elements. */
  private Node emitElement(
      Element element, List<Node> nodes, Set<String> usedClasses, IdGenerator ids) {
    String sourceTag = element.normalName();
    if (DROPPED_TAGS.contains(sourceTag)) {
      return null;
    }
    if (sourceTag.equals("svg")) {
      Node embed = embedNode(ids.next("svg"), element.outerHtml());
      nodes.add(embed);
      return embed;
    }
    String tag = DIV_TAGS.contains(sourceTag) ? "div" : sourceTag;
    NodeType type = NodeType.fromTag(tag);
    List<String> classes = new ArrayList<>(element.classNames());
    usedClasses.addAll(classes);

    String base = classes.isEmpty() ? element.id() : classes.get(0);
    if (base.isEmpty()) {
      base = tag;
    }
    Node node =
        Node.builder()
            .id(ids.next(base))
            .type(type.label())
            .tag(tag)
            .classes(classes)
            .children(new ArrayList<>())
            .data(elementData(element, tag, type))
            .build();
    nodes.add(node);

    if (type == NodeType.IMAGE) {
      return node;
    }
    for (org.jsoup.nodes.Node child : element.childNodes()) {
      if (child instanceof TextNode textNode) {
        String text = WHITESPACE.matcher(textNode.getWholeText()).replaceAll(" ");
        if (!text.isBlank()) {
          Node run = Node.textRun(ids.next("text"), text);
          nodes.add(run);
          node.getChildren().add(run.getId());
        }
      } else if (child instanceof Element childElement) {
        if (childElement.normalName().equals("br")) {
          Node run = Node.textRun(ids.next("br"), "\n");
          nodes.add(run);
          node.getChildren().add(run.getId());
          continue;
        }
        Node emitted = emitElement(childElement, nodes, usedClasses, ids);
        if (emitted != null) {
          node.getChildren().add(emitted.getId());
        }
      }
    }
    return node;
  }

  private static NodeData elementData(Element element, String tag, NodeType type) {
    List<NodeData.Attribute> xattr = new ArrayList<>();
    for (Attribute attribute : element.attributes()) {
      String key = attribute.getKey().toLowerCase(Locale.ROOT);
      if (key.startsWith("data-") || key.startsWith("aria-") || key.equals("id")) {
        xattr.add(new NodeData.Attribute(attribute.getKey(), attribute.getValue()));
      }
    }
    NodeData data = NodeData.builder().tag(tag).text(false).xattr(xattr).build();
    if (type == NodeType.LINK) {
      data.setLink(linkOf(element));
    } else if (type == NodeType.IMAGE) {
      data.setAttr(
          new NodeData.ImageAttr(
              element.attr("src"),
              element.attr("alt"),
              element.hasAttr("loading") ? element.attr("loading") : "lazy"));
    }
    return data;
  }

  private static NodeData.Link linkOf(Element anchor) {
    String href = anchor.attr("href").trim();
    String target = anchor.hasAttr("target") ? anchor.attr("target") : null;
    String lower = href.toLowerCase(Locale.ROOT);
    String mode;
    if (lower.startsWith("mailto:")) {
      mode = "email";
    } else if (lower.startsWith("tel:")) {
      mode = "phone";
    } else if (href.startsWith("#") && href.length() > 1) {
      mode = "section";
    } else {
      mode = "external";
    }
    return new NodeData.Link(mode, href.isEmpty() ? "#" : href, target);
  }

  private static Node embedNode(String id, String html) {
    return Node.builder()
        .id(id)
        .type(NodeType.HTML_EMBED.label())
        .tag("div")
        .classes(new ArrayList<>())
        .children(new ArrayList<>())
        .data(NodeData.builder().tag("div").text(false).embed(NodeData.Embed.html(html)).build())
        .build();
  }

  private List<Style> buildStyles(
      RoutingTrace trace, Set<String> usedClasses, TokenManifest manifest, List<String> warnings) {
    Map<String, Style> styles = new LinkedHashMap<>();
    for (String className : usedClasses) {
      styles.put(className, Style.emptyClass(className));
    }

    String marker = config.getStyle().getCombinatorMarker();
    for (RoutedRule rule : trace.nativeRules()) {
      List<String> chain = rule.classChain();
      if (chain.isEmpty() || !usedClasses.containsAll(chain)) {
        continue;
      }
      Style target = styles.get(chain.get(chain.size() - 1));
      if (chain.size() > 1) {
        Style base = styles.get(chain.get(0));
        for (String modifier : chain.subList(1, chain.size())) {
          styles.get(modifier).setComb(marker);
          if (!base.getChildren().contains(modifier)) {
            base.getChildren().add(modifier);
          }
        }
      }

      String resolved = variableResolver.resolve(rule.nativeOutput(), manifest);
      ParsedStyle parsed = styleValueParser.parse(resolved);
      parsed.warnings().forEach(w -> warnings.add(rule.selector() + ": " + w));
      if (parsed.isEmpty()) {
        continue;
      }
      String styleLess = styleValueParser.toStyleLess(parsed.properties());
      String variant = variantKey(rule);
      if (variant == null) {
        target.setStyleLess(styleValueParser.merge(target.getStyleLess(), styleLess));
      } else {
        Style.Variant existing = target.getVariants().get(variant);
        String merged =
            existing == null ? styleLess : styleValueParser.merge(existing.styleLess(), styleLess);
        target.getVariants().put(variant, new Style.Variant(merged));
      }
    }
    return new ArrayList<>(styles.values());
  }

  /** Variant key for a rule, or null for the base breakpoint without a state. */
  private static String variantKey(RoutedRule rule) {
    String breakpoint = rule.breakpoint() == null ? MAIN_BREAKPOINT : rule.breakpoint().mapped();
    String state = rule.state();
    if (breakpoint.equals(MAIN_BREAKPOINT)) {
      return state;
    }
    return state == null ? breakpoint : breakpoint + "_" + state;
  }
}
