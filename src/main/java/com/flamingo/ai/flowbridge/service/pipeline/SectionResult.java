package com.flamingo.ai.flowbridge.service.pipeline;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.graph.ConversionSource;
import com.flamingo.ai.flowbridge.service.routing.RoutingTrace;
import com.flamingo.ai.flowbridge.service.safety.ChunkedEmbed;
import com.flamingo.ai.flowbridge.service.safety.SafetyReport;
import com.flamingo.ai.flowbridge.service.section.Section;
import java.util.List;

/**
 * One converted and gated section.
 *
 * @param section detected section
 * @param document sanitized document
 * @param safetyReport gate findings for the document and its CSS embed
 * @param routingTrace per-rule routing decisions for the section CSS
 * @param source how the candidate document was produced
 * @param generationFixes placeholder patches applied to a generated document
 * @param buildWarnings style values dropped while building
 * @param chunkedEmbeds embed chunks when chunking is enabled
 */
public record SectionResult(
    Section section,
    XscpDocument document,
    SafetyReport safetyReport,
    RoutingTrace routingTrace,
    ConversionSource source,
    List<String> generationFixes,
    List<String> buildWarnings,
    List<ChunkedEmbed> chunkedEmbeds) {

  public SectionResult {
    generationFixes = List.copyOf(generationFixes);
    buildWarnings = List.copyOf(buildWarnings);
    chunkedEmbeds = List.copyOf(chunkedEmbeds);
  }
}
