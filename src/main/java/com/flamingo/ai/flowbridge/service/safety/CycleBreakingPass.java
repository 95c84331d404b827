package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Pass 3. Cuts cycles in the node tree and in style combo chains. Runs after identity repair, since
 * a regenerated duplicate id can close a loop that was not there before. Each back edge found by a
 * depth-first walk is removed; the walk keeps its own stack so chain length is not bounded by the
 * thread stack.
 */
@Slf4j
final class CycleBreakingPass implements SafetyPass {

  private static final byte UNVISITED = 0;
  private static final byte ON_PATH = 1;
  private static final byte DONE = 2;

  @Override
  public String name() {
    return "cycle-breaking";
  }

  @Override
  public void apply(XscpDocument document, SafetyFindings findings) {
    DocumentGraph graph = DocumentGraph.of(document.getPayload());
    cutCycles(
        graph.nodes().size(),
        slot -> childrenOf(graph.nodes().get(slot)),
        graph::nodeSlot,
        slot -> graph.nodes().get(slot).getId(),
        "node",
        findings);
    cutCycles(
        graph.styles().size(),
        slot -> childrenOf(graph.styles().get(slot)),
        graph::styleSlotForReference,
        slot -> graph.styles().get(slot).getName(),
        "style",
        findings);
  }

  // ---- private helpers ----

  private static List<String> childrenOf(Node node) {
    return node.getChildren() == null ? List.of() : node.getChildren();
  }

  private static List<String> childrenOf(Style style) {
    return style.getChildren() == null ? List.of() : style.getChildren();
  }

  private static void cutCycles(
      int size,
      IntFunction<List<String>> children,
      ToIntFunction<String> slotOf,
      IntFunction<String> label,
      String kind,
      SafetyFindings findings) {
    byte[] state = new byte[size];
    Deque<Frame> path = new ArrayDeque<>();
    for (int root = 0; root < size; root++) {
      if (state[root] != UNVISITED) {
        continue;
      }
      state[root] = ON_PATH;
      path.push(new Frame(root, children.apply(root)));
      while (!path.isEmpty()) {
        Frame frame = path.peek();
        if (frame.next >= frame.children.size()) {
          state[frame.slot] = DONE;
          path.pop();
          continue;
        }
        String child = frame.children.get(frame.next++);
        int childSlot = child == null ? -1 : slotOf.applyAsInt(child);
        if (childSlot < 0) {
          continue;
        }
        if (state[childSlot] == ON_PATH) {
          children.apply(frame.slot).remove(child);
          String parent = label.apply(frame.slot);
          findings.warn("Cut " + kind + " cycle edge " + parent + " -> " + child);
          log.debug("Cut {} cycle edge {} -> {}", kind, parent, child);
        } else if (state[childSlot] == UNVISITED) {
          state[childSlot] = ON_PATH;
          path.push(new Frame(childSlot, children.apply(childSlot)));
        }
      }
    }
  }

  /** One element on the walk, with a snapshot of its children so cuts do not shift the cursor. */
  private static final class Frame {
    private final int slot;
    private final List<String> children;
    private int next;

    Frame(int slot, List<String> children) {
      this.slot = slot;
      this.children = new ArrayList<>(children);
    }
  }
}
