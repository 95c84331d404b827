package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpPayload;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index over a payload's flat node and style lists. Elements are addressed by slot (list
 * position); identifiers map to every slot that carries them, so duplicates stay visible.
 *
 * <p>The index is a snapshot: rebuild it after a pass changes identifiers or list membership.
 */
final class DocumentGraph {

  private final List<Node> nodes;
  private final List<Style> styles;
  private final Map<String, List<Integer>> nodeSlots = new LinkedHashMap<>();
  private final Map<String, List<Integer>> styleSlots = new LinkedHashMap<>();
  private final Map<String, List<Integer>> styleSlotsByName = new LinkedHashMap<>();

  private DocumentGraph(List<Node> nodes, List<Style> styles) {
    this.nodes = nodes;
    this.styles = styles;
    for (int slot = 0; slot < nodes.size(); slot++) {
      Node node = nodes.get(slot);
      if (node != null && node.getId() != null) {
        nodeSlots.computeIfAbsent(node.getId(), k -> new ArrayList<>()).add(slot);
      }
    }
    for (int slot = 0; slot < styles.size(); slot++) {
      Style style = styles.get(slot);
      if (style == null) {
        continue;
      }
      if (style.getId() != null) {
        styleSlots.computeIfAbsent(style.getId(), k -> new ArrayList<>()).add(slot);
      }
      if (style.getName() != null) {
        styleSlotsByName.computeIfAbsent(style.getName(), k -> new ArrayList<>()).add(slot);
      }
    }
  }

  static DocumentGraph of(XscpPayload payload) {
    return new DocumentGraph(payload.getNodes(), payload.getStyles());
  }

  List<Node> nodes() {
    return nodes;
  }

  List<Style> styles() {
    return styles;
  }

  Map<String, List<Integer>> nodeSlots() {
    return nodeSlots;
  }

  Map<String, List<Integer>> styleSlots() {
    return styleSlots;
  }

  boolean hasNode(String id) {
    return nodeSlots.containsKey(id);
  }

  boolean hasStyle(String id) {
    return styleSlots.containsKey(id);
  }

  /** Slots of styles with the given name. */
  List<Integer> styleSlotsNamed(String name) {
    return styleSlotsByName.getOrDefault(name, List.of());
  }

  /** First node slot carrying the id, or -1. */
  int nodeSlot(String id) {
    List<Integer> slots = nodeSlots.get(id);
    return slots == null ? -1 : slots.get(0);
  }

  /**
   * Slot of the style a child reference points to: by id first, then by unique name.
   *
   * @return the slot, or -1 when the reference resolves to nothing
   */
  int styleSlotForReference(String reference) {
    List<Integer> byId = styleSlots.get(reference);
    if (byId != null) {
      return byId.get(0);
    }
    List<Integer> byName = styleSlotsByName.get(reference);
    return byName == null || byName.size() != 1 ? -1 : byName.get(0);
  }

  /** Node slots that no child list references, in list order. */
  List<Integer> rootNodeSlots() {
    Set<String> referenced = new HashSet<>();
    for (Node node : nodes) {
      if (node != null && node.getChildren() != null) {
        referenced.addAll(node.getChildren());
      }
    }
    List<Integer> roots = new ArrayList<>();
    for (int slot = 0; slot < nodes.size(); slot++) {
      Node node = nodes.get(slot);
      if (node != null && !referenced.contains(node.getId())) {
        roots.add(slot);
      }
    }
    return roots;
  }

  /**
   * Deepest nesting level below any root, counting a root as level 1. Assumes an acyclic
   * children graph; revisited slots are not descended again.
   *
   * @return slot of the deepest node mapped to its depth, or an empty map for an empty document
   */
  Map<Integer, Integer> deepestNode() {
    Map<Integer, Integer> depthBySlot = new HashMap<>();
    List<Integer> starts = rootNodeSlots();
    if (starts.isEmpty() && !nodes.isEmpty()) {
      starts = List.of(0);
    }
    int deepestSlot = -1;
    int deepest = 0;
    List<int[]> stack = new ArrayList<>();
    for (int root : starts) {
      stack.add(new int[] {root, 1});
    }
    while (!stack.isEmpty()) {
      int[] entry = stack.remove(stack.size() - 1);
      int slot = entry[0];
      int depth = entry[1];
      if (depthBySlot.containsKey(slot)) {
        continue;
      }
      depthBySlot.put(slot, depth);
      if (depth > deepest) {
        deepest = depth;
        deepestSlot = slot;
      }
      Node node = nodes.get(slot);
      if (node == null || node.getChildren() == null) {
        continue;
      }
      for (String child : node.getChildren()) {
        int childSlot = nodeSlot(child);
        if (childSlot >= 0) {
          stack.add(new int[] {childSlot, depth + 1});
        }
      }
    }
    return deepestSlot < 0 ? Map.of() : Map.of(deepestSlot, deepest);
  }
}
