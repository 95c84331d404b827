package com.flamingo.ai.flowbridge.api.dto.response;

import com.flamingo.ai.flowbridge.service.pipeline.PageConversion;
import com.flamingo.ai.flowbridge.service.pipeline.SectionResult;
import com.flamingo.ai.flowbridge.service.safety.SafetyReport;
import com.flamingo.ai.flowbridge.service.safety.SafetyStatus;
import com.flamingo.ai.flowbridge.service.token.FontReport;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a page conversion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageConversionResponse {

  private String title;
  private SafetyStatus status;
  private TokenManifest tokens;
  private FontReport fonts;
  private List<SectionResult> sections;
  private SafetyReport scriptReport;

  public static PageConversionResponse from(PageConversion conversion) {
    return PageConversionResponse.builder()
        .title(conversion.title())
        .status(conversion.overallStatus())
        .tokens(conversion.tokens())
        .fonts(conversion.fonts())
        .sections(conversion.sections())
        .scriptReport(conversion.scriptReport())
        .build();
  }
}
