package com.flamingo.ai.flowbridge.api.dto.response;

import com.flamingo.ai.flowbridge.service.token.FontReport;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for token extraction. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenExtractionResponse {
  private TokenManifest manifest;
  private FontReport fonts;
}
