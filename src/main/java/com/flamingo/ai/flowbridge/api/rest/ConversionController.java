package com.flamingo.ai.flowbridge.api.rest;

import com.flamingo.ai.flowbridge.api.dto.request.ConvertPageRequest;
import com.flamingo.ai.flowbridge.api.dto.request.DetectSectionsRequest;
import com.flamingo.ai.flowbridge.api.dto.request.ExtractionSettings;
import com.flamingo.ai.flowbridge.api.dto.response.PageConversionResponse;
import com.flamingo.ai.flowbridge.api.dto.response.SectionDetectionResponse;
import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.service.pipeline.PageConversion;
import com.flamingo.ai.flowbridge.service.pipeline.PageConversionService;
import com.flamingo.ai.flowbridge.service.section.CssExtractionOptions;
import com.flamingo.ai.flowbridge.service.section.SectionDetector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for page conversion and section detection. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ConversionController {

  private final PageConversionService pageConversionService;
  private final SectionDetector sectionDetector;
  private final FlowbridgeConfig config;

  /** Converts a whole page into one gated document per section. */
  @PostMapping("/conversions")
  public ResponseEntity<PageConversionResponse> convert(
      @Valid @RequestBody ConvertPageRequest request) {
    PageConversion conversion =
        pageConversionService.convert(
            request.getHtml(),
            request.getIdPrefix(),
            Boolean.TRUE.equals(request.getUseGeneration()),
            options(request.getExtraction()));
    return ResponseEntity.ok(PageConversionResponse.from(conversion));
  }

  /** Detects sections without converting them. */
  @PostMapping("/sections/detect")
  public ResponseEntity<SectionDetectionResponse> detect(
      @Valid @RequestBody DetectSectionsRequest request) {
    return ResponseEntity.ok(
        SectionDetectionResponse.from(
            sectionDetector.detect(request.getHtml(), options(request.getExtraction()))));
  }

  private CssExtractionOptions options(ExtractionSettings settings) {
    CssExtractionOptions defaults = CssExtractionOptions.from(config.getExtraction());
    return settings == null ? defaults : settings.applyTo(defaults);
  }
}
