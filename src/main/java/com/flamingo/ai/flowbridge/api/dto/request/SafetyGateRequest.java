package com.flamingo.ai.flowbridge.api.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.flowbridge.service.safety.EmbedContent;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for running the safety gate on arbitrary JSON. The document is kept as a raw tree
 * so shape problems come back as a blocked report instead of a binding error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyGateRequest {

  @NotNull(message = "Document is required")
  private JsonNode document;

  private Embeds embeds;

  public EmbedContent embedContent() {
    return embeds == null
        ? EmbedContent.none()
        : new EmbedContent(embeds.getHtml(), embeds.getCss(), embeds.getJs());
  }

  /** Raw embeds travelling with the document. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Embeds {
    private String html;
    private String css;
    private String js;
  }
}
