package com.flamingo.ai.flowbridge.api.rest;

import com.flamingo.ai.flowbridge.api.dto.request.ExtractTokensRequest;
import com.flamingo.ai.flowbridge.api.dto.response.TokenExtractionResponse;
import com.flamingo.ai.flowbridge.service.token.FontDetector;
import com.flamingo.ai.flowbridge.service.token.TokenExtractor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for design token and font extraction. */
@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
public class TokenController {

  private final TokenExtractor tokenExtractor;
  private final FontDetector fontDetector;

  @PostMapping
  public ResponseEntity<TokenExtractionResponse> extract(
      @Valid @RequestBody ExtractTokensRequest request) {
    return ResponseEntity.ok(
        TokenExtractionResponse.builder()
            .manifest(tokenExtractor.extract(request.getCss(), request.getTitle()))
            .fonts(fontDetector.detect(request.getCss()))
            .build());
  }
}
