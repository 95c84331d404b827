package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Pass 4. Reports deep nesting; never flattens. */
@Slf4j
final class NestingDepthPass implements SafetyPass {

  private final int safeLimit;
  private final int maxLimit;

  NestingDepthPass(FlowbridgeConfig.Safety.Depth depth) {
    this.safeLimit = depth.getSafeLimit();
    this.maxLimit = depth.getMaxLimit();
  }

  @Override
  public String name() {
    return "nesting-depth";
  }

  @Override
  public void apply(XscpDocument document, SafetyFindings findings) {
    DocumentGraph graph = DocumentGraph.of(document.getPayload());
    Map<Integer, Integer> deepest = graph.deepestNode();
    if (deepest.isEmpty()) {
      return;
    }
    Map.Entry<Integer, Integer> entry = deepest.entrySet().iterator().next();
    int depth = entry.getValue();
    String nodeId = graph.nodes().get(entry.getKey()).getId();
    if (depth > maxLimit) {
      findings.warn(
          "Nesting depth "
              + depth
              + " exceeds the maximum of "
              + maxLimit
              + " at node "
              + nodeId
              + "; consider flattening");
    } else if (depth > safeLimit) {
      log.debug("Nesting depth {} above safe limit {} at node {}", depth, safeLimit, nodeId);
    }
  }
}
