package com.flamingo.ai.flowbridge.api.dto.request;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import jakarta.validation.constraints.NotNull;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for rewriting variable references to destination identifiers. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemapVariablesRequest {

  @NotNull(message = "Document is required")
  private XscpDocument document;

  /** CSS variable name, with the leading dashes, to destination identifier. */
  @Builder.Default private Map<String, String> variableIds = new HashMap<>();
}
