package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import java.util.List;

/**
 * Output of the safety gate.
 *
 * @param document sanitized document; an empty document when the input could not be read
 * @param report findings
 * @param sanitizationApplied true when any pass changed the document or the HTML embed
 * @param embeds the embeds that travelled with the document, HTML embed cleaned
 * @param chunkedEmbeds chunks for over-limit embeds when chunking is enabled
 */
public record SafetyGateResult(
    XscpDocument document,
    SafetyReport report,
    boolean sanitizationApplied,
    EmbedContent embeds,
    List<ChunkedEmbed> chunkedEmbeds) {

  public SafetyGateResult {
    chunkedEmbeds = List.copyOf(chunkedEmbeds);
  }
}
