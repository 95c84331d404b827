package com.flamingo.ai.flowbridge.service.graph;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.routing.RoutingTrace;
import java.util.List;

/**
 * Output of the deterministic builder.
 *
 * @param document candidate document
 * @param warnings style parse warnings, prefixed with the selector they came from
 * @param routingTrace routing decisions the style split followed
 * @param embedCss CSS carried in the document's embed node, empty when none
 */
public record GraphBuildResult(
    XscpDocument document, List<String> warnings, RoutingTrace routingTrace, String embedCss) {

  public GraphBuildResult {
    warnings = List.copyOf(warnings);
  }
}
