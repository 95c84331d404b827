package com.flamingo.ai.flowbridge.api.dto.response;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.safety.ChunkedEmbed;
import com.flamingo.ai.flowbridge.service.safety.EmbedContent;
import com.flamingo.ai.flowbridge.service.safety.SafetyGateResult;
import com.flamingo.ai.flowbridge.service.safety.SafetyReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a safety gate run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyGateResponse {

  private XscpDocument document;
  private SafetyReport report;
  private boolean sanitizationApplied;
  private EmbedContent embeds;
  private List<ChunkedEmbed> chunkedEmbeds;

  public static SafetyGateResponse from(SafetyGateResult result) {
    return SafetyGateResponse.builder()
        .document(result.document())
        .report(result.report())
        .sanitizationApplied(result.sanitizationApplied())
        .embeds(result.embeds())
        .chunkedEmbeds(result.chunkedEmbeds())
        .build();
  }
}
