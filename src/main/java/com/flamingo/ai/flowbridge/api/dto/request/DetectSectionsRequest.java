package com.flamingo.ai.flowbridge.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for section detection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectSectionsRequest {

  @NotBlank(message = "HTML is required")
  private String html;

  private ExtractionSettings extraction;
}
