package com.flamingo.ai.flowbridge.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for token extraction. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractTokensRequest {

  /** Stylesheet text or full page markup. */
  @NotBlank(message = "CSS is required")
  private String css;

  @Size(max = 255, message = "Title must not exceed 255 characters")
  private String title;
}
