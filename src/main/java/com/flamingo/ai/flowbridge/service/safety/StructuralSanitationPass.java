package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.NodeData;
import com.flamingo.ai.flowbridge.domain.xscp.NodeType;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Pass 1. Repairs content known to break the consumer: text runs carrying markup, embed markup
 * carrying document-level tags or event handlers, variant keys outside the vocabulary,
 * reserved-prefix identifiers and dangling child references.
 */
@Slf4j
final class StructuralSanitationPass implements SafetyPass {

  private static final Pattern BR_TAG = Pattern.compile("(?i)<br\\s*/?>");

  private final FlowbridgeConfig.Style styleConfig;
  private final String reservedPrefix;
  private final String renamePrefix;
  private final EmbedHtmlSanitizer embedHtmlSanitizer;

  StructuralSanitationPass(FlowbridgeConfig config, EmbedHtmlSanitizer embedHtmlSanitizer) {
    this.styleConfig = config.getStyle();
    this.reservedPrefix = config.getSafety().getReservedPrefix();
    this.renamePrefix = config.getSafety().getReservedRenamePrefix();
    this.embedHtmlSanitizer = embedHtmlSanitizer;
  }

  @Override
  public String name() {
    return "structural-sanitation";
  }

  @Override
  public void apply(XscpDocument document, SafetyFindings findings) {
    remapStyleNameReferences(document, findings);
    stripLineBreaks(document, findings);
    sanitizeEmbedNodes(document, findings);
    removeInvalidVariants(document, findings);
    renameReservedIdentifiers(document, findings);
    removeDanglingChildren(document, findings);
  }

  /** True when {@code key} is a breakpoint, a pseudo-state or {@code breakpoint_pseudo}. */
  static boolean isValidVariantKey(String key, FlowbridgeConfig.Style styleConfig) {
    if (key == null || key.isEmpty()) {
      return false;
    }
    if (styleConfig.getBreakpoints().contains(key) || styleConfig.getPseudoStates().contains(key)) {
      return true;
    }
    int underscore = key.indexOf('_');
    return underscore > 0
        && styleConfig.getBreakpoints().contains(key.substring(0, underscore))
        && styleConfig.getPseudoStates().contains(key.substring(underscore + 1));
  }

  // ---- private helpers ----

  private void remapStyleNameReferences(XscpDocument document, SafetyFindings findings) {
    DocumentGraph graph = DocumentGraph.of(document.getPayload());
    int remapped = 0;
    Set<String> ambiguous = new HashSet<>();
    for (Node node : graph.nodes()) {
      List<String> classes = node.getClasses();
      if (classes == null) {
        continue;
      }
      for (int i = 0; i < classes.size(); i++) {
        String reference = classes.get(i);
        if (reference == null || graph.hasStyle(reference)) {
          continue;
        }
        List<Integer> named = graph.styleSlotsNamed(reference);
        if (named.size() == 1) {
          classes.set(i, graph.styles().get(named.get(0)).getId());
          remapped++;
        } else if (named.size() > 1 && ambiguous.add(reference)) {
          findings.warn(
              "Class reference \"" + reference + "\" matches " + named.size() + " style names");
        }
      }
    }
    if (remapped > 0) {
      findings.fix("Remapped " + remapped + " class reference(s) from style names to IDs");
    }
  }

  private void stripLineBreaks(XscpDocument document, SafetyFindings findings) {
    int cleaned = 0;
    for (Node node : document.getPayload().getNodes()) {
      if (node.isTextRun() && node.getV() != null && BR_TAG.matcher(node.getV()).find()) {
        node.setV(BR_TAG.matcher(node.getV()).replaceAll("\n"));
        cleaned++;
      }
    }
    if (cleaned > 0) {
      findings.fix("Removed <br> tags from " + cleaned + " text node(s)");
    }
  }

  private void sanitizeEmbedNodes(XscpDocument document, SafetyFindings findings) {
    for (Node node : document.getPayload().getNodes()) {
      if (!node.isType(NodeType.HTML_EMBED)) {
        continue;
      }
      NodeData.EmbedMeta meta = embedMeta(node);
      String raw =
          meta != null && meta.getHtml() != null && !meta.getHtml().isEmpty()
              ? meta.getHtml()
              : node.getV();
      EmbedHtmlSanitizer.Sanitized sanitized = embedHtmlSanitizer.sanitize(raw);
      if (sanitized.changed()) {
        if (meta != null && raw.equals(meta.getHtml())) {
          meta.setHtml(sanitized.html());
        }
        if (raw.equals(node.getV())) {
          node.setV(sanitized.html());
        }
        log.debug("Sanitized embed markup of node {}", node.getId());
      }
      sanitized.changes().forEach(c -> findings.fix("HtmlEmbed " + node.getId() + ": " + c));
      sanitized.warnings().forEach(w -> findings.warn("HtmlEmbed " + node.getId() + ": " + w));
    }
  }

  private static NodeData.EmbedMeta embedMeta(Node node) {
    if (node.getData() == null || node.getData().getEmbed() == null) {
      return null;
    }
    return node.getData().getEmbed().getMeta();
  }

  private void removeInvalidVariants(XscpDocument document, SafetyFindings findings) {
    for (Style style : document.getPayload().getStyles()) {
      if (style.getVariants() == null) {
        continue;
      }
      Iterator<String> keys = style.getVariants().keySet().iterator();
      while (keys.hasNext()) {
        String key = keys.next();
        if (!isValidVariantKey(key, styleConfig)) {
          keys.remove();
          findings.fix(
              "Removed invalid variant \"" + key + "\" from style " + style.getName());
        }
      }
    }
  }

  private void renameReservedIdentifiers(XscpDocument document, SafetyFindings findings) {
    for (Style style : document.getPayload().getStyles()) {
      if (isReserved(style.getId()) || isReserved(style.getName())) {
        String renamed = renameIfReserved(style.getName());
        findings.fix("Renamed reserved style " + style.getName() + " to " + renamed);
        style.setId(renameIfReserved(style.getId()));
        style.setName(renamed);
      }
      style.getChildren().replaceAll(this::renameIfReserved);
    }
    for (Node node : document.getPayload().getNodes()) {
      if (isReserved(node.getId())) {
        findings.fix("Renamed reserved node id " + node.getId() + " to " + rename(node.getId()));
        node.setId(rename(node.getId()));
      }
      if (node.getChildren() != null) {
        node.getChildren().replaceAll(this::renameIfReserved);
      }
      if (node.getClasses() != null && node.getClasses().stream().anyMatch(this::isReserved)) {
        node.getClasses().replaceAll(this::renameIfReserved);
        findings.fix("Renamed reserved class reference(s) on node " + node.getId());
      }
    }
  }

  private boolean isReserved(String identifier) {
    return identifier != null && !reservedPrefix.isEmpty() && identifier.startsWith(reservedPrefix);
  }

  private String rename(String identifier) {
    return renamePrefix + identifier.substring(reservedPrefix.length());
  }

  private String renameIfReserved(String identifier) {
    return isReserved(identifier) ? rename(identifier) : identifier;
  }

  private void removeDanglingChildren(XscpDocument document, SafetyFindings findings) {
    DocumentGraph graph = DocumentGraph.of(document.getPayload());
    for (Node node : graph.nodes()) {
      if (node.getChildren() != null
          && node.getChildren().removeIf(child -> child == null || !graph.hasNode(child))) {
        findings.fix("Removed dangling child reference(s) from node " + node.getId());
      }
    }
    for (Style style : graph.styles()) {
      if (style.getChildren() != null
          && style
              .getChildren()
              .removeIf(child -> child == null || graph.styleSlotForReference(child) < 0)) {
        findings.fix("Removed dangling combo reference(s) from style " + style.getName());
      }
    }
  }
}
