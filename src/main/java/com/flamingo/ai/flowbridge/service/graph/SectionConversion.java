package com.flamingo.ai.flowbridge.service.graph;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.routing.RoutingTrace;
import java.util.List;

/**
 * One section's candidate document before the safety gate.
 *
 * @param document candidate document
 * @param source generated or deterministic
 * @param fixes placeholder patches applied to a generated document
 * @param warnings style parse warnings from the deterministic build
 * @param routingTrace routing decisions for the section CSS
 * @param embedCss CSS the section carries as an embed
 */
public record SectionConversion(
    XscpDocument document,
    ConversionSource source,
    List<String> fixes,
    List<String> warnings,
    RoutingTrace routingTrace,
    String embedCss) {

  public SectionConversion {
    fixes = List.copyOf(fixes);
    warnings = List.copyOf(warnings);
  }
}
