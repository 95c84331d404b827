package com.flamingo.ai.flowbridge.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a CSS routing trace. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceRoutingRequest {

  @NotNull(message = "CSS is required")
  private String css;
}
