package com.flamingo.ai.flowbridge.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for converting a whole page. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConvertPageRequest {

  @NotBlank(message = "HTML is required")
  private String html;

  @Pattern(regexp = "^[a-z][a-z0-9-]*$", message = "idPrefix must be a lower-case slug")
  private String idPrefix;

  /** Whether to try the configured generation service first. Defaults to false. */
  private Boolean useGeneration;

  @Valid private ExtractionSettings extraction;
}
