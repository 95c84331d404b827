package com.flamingo.ai.flowbridge.api.dto.response;

import com.flamingo.ai.flowbridge.service.section.Section;
import com.flamingo.ai.flowbridge.service.section.SectionDetectionResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for section detection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionDetectionResponse {

  private String title;
  private int sectionCount;
  private List<Section> sections;

  public static SectionDetectionResponse from(SectionDetectionResult result) {
    return SectionDetectionResponse.builder()
        .title(result.title())
        .sectionCount(result.sections().size())
        .sections(result.sections())
        .build();
  }
}
