package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Pass 2. Gives every duplicated node or style identifier a fresh {@code <id>-<k>} form. The k-th
 * reference to a duplicated identifier, in document order, is pointed at its k-th occurrence, so
 * two nodes that each referenced "their" copy of a style keep distinct targets. Node class lists
 * and style combo lists are counted separately, each against its own occurrence order.
 */
final class IdentityIntegrityPass implements SafetyPass {

  @Override
  public String name() {
    return "identity-integrity";
  }

  @Override
  public void apply(XscpDocument document, SafetyFindings findings) {
    DocumentGraph graph = DocumentGraph.of(document.getPayload());
    Map<String, List<String>> nodeIds =
        regenerate(graph.nodeSlots(), slot -> graph.nodes().get(slot), "node", findings);
    Map<String, List<String>> styleIds =
        regenerate(graph.styleSlots(), slot -> graph.styles().get(slot), "style", findings);
    if (nodeIds.isEmpty() && styleIds.isEmpty()) {
      return;
    }

    ReferenceCursor nodeCursor = new ReferenceCursor(nodeIds);
    ReferenceCursor classCursor = new ReferenceCursor(styleIds);
    for (Node node : graph.nodes()) {
      if (node.getChildren() != null) {
        node.getChildren().replaceAll(nodeCursor::next);
      }
      if (node.getClasses() != null) {
        node.getClasses().replaceAll(classCursor::next);
      }
    }
    ReferenceCursor comboCursor = new ReferenceCursor(styleIds);
    for (Style style : graph.styles()) {
      if (style.getChildren() != null) {
        style.getChildren().replaceAll(comboCursor::next);
      }
    }
  }

  // ---- private helpers ----

  /**
   * Renames every occurrence after the first of each duplicated identifier.
   *
   * @return duplicated identifier mapped to its identifiers in occurrence order
   */
  private static Map<String, List<String>> regenerate(
      Map<String, List<Integer>> slotsById,
      Function<Integer, Object> element,
      String kind,
      SafetyFindings findings) {
    Set<String> taken = new HashSet<>(slotsById.keySet());
    Map<String, List<String>> renamed = new HashMap<>();
    slotsById.forEach(
        (id, slots) -> {
          if (slots.size() < 2) {
            return;
          }
          List<String> occurrences = new ArrayList<>();
          occurrences.add(id);
          int suffix = 1;
          for (int k = 1; k < slots.size(); k++) {
            String fresh = id + "-" + suffix;
            while (!taken.add(fresh)) {
              suffix++;
              fresh = id + "-" + suffix;
            }
            suffix++;
            setId(element.apply(slots.get(k)), id, fresh);
            occurrences.add(fresh);
            findings.fix("Regenerated duplicate " + kind + " id " + id + " as " + fresh);
          }
          renamed.put(id, occurrences);
        });
    return renamed;
  }

  private static void setId(Object element, String oldId, String freshId) {
    if (element instanceof Node node) {
      node.setId(freshId);
    } else if (element instanceof Style style) {
      style.setId(freshId);
      if (oldId.equals(style.getName())) {
        style.setName(freshId);
      }
    }
  }

  /** Hands out the k-th identifier for the k-th reference; later references keep the last one. */
  private static final class ReferenceCursor {
    private final Map<String, List<String>> occurrences;
    private final Map<String, Integer> seen = new HashMap<>();

    ReferenceCursor(Map<String, List<String>> occurrences) {
      this.occurrences = occurrences;
    }

    String next(String reference) {
      List<String> ids = occurrences.get(reference);
      if (ids == null) {
        return reference;
      }
      int index = seen.merge(reference, 1, Integer::sum) - 1;
      return ids.get(Math.min(index, ids.size() - 1));
    }
  }
}
