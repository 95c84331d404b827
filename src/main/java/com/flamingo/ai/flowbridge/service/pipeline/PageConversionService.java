package com.flamingo.ai.flowbridge.service.pipeline;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.graph.SectionConversion;
import com.flamingo.ai.flowbridge.service.graph.SectionConversionService;
import com.flamingo.ai.flowbridge.service.safety.EmbedContent;
import com.flamingo.ai.flowbridge.service.safety.SafetyGate;
import com.flamingo.ai.flowbridge.service.safety.SafetyGateResult;
import com.flamingo.ai.flowbridge.service.section.CssExtractionOptions;
import com.flamingo.ai.flowbridge.service.section.Section;
import com.flamingo.ai.flowbridge.service.section.SectionDetectionResult;
import com.flamingo.ai.flowbridge.service.section.SectionDetector;
import com.flamingo.ai.flowbridge.service.token.FontDetector;
import com.flamingo.ai.flowbridge.service.token.FontReport;
import com.flamingo.ai.flowbridge.service.token.TokenExtractor;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs a whole page through detection, token extraction, per-section conversion and the safety
 * gate, then announces the result with a {@link PageConvertedEvent}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageConversionService {

  private final SectionDetector sectionDetector;
  private final TokenExtractor tokenExtractor;
  private final FontDetector fontDetector;
  private final SectionConversionService sectionConversionService;
  private final SafetyGate safetyGate;
  private final ApplicationEventPublisher eventPublisher;

  /**
   * Converts a page.
   *
   * @param html full page markup
   * @param idPrefix node identifier prefix, may be blank
   * @param useGeneration whether to try the configured generator per section
   * @param options CSS extraction options
   * @return per-section results in source order
   */
  @Timed(value = "flowbridge.conversion.page", description = "Time to convert one page")
  public PageConversion convert(
      String html, String idPrefix, boolean useGeneration, CssExtractionOptions options) {
    SectionDetectionResult detection = sectionDetector.detect(html, options);
    TokenManifest manifest = tokenExtractor.extract(html, detection.title());
    FontReport fonts = fontDetector.detect(html);
    log.debug(
        "Detected {} section(s) and {} token(s) on page '{}'",
        detection.sections().size(),
        manifest.variables().size(),
        detection.title());

    List<SectionResult> results = new ArrayList<>();
    for (Section section : detection.sections()) {
      results.add(convertSection(section, idPrefix, manifest, useGeneration));
    }

    SafetyGateResult scripts =
        safetyGate.evaluate(
            XscpDocument.empty(), new EmbedContent(null, null, detection.scriptContent()));
    PageConversion conversion =
        new PageConversion(detection.title(), manifest, fonts, results, scripts.report());
    eventPublisher.publishEvent(new PageConvertedEvent(conversion, useGeneration));
    return conversion;
  }

  // ---- private helpers ----

  private SectionResult convertSection(
      Section section, String idPrefix, TokenManifest manifest, boolean useGeneration) {
    SectionConversion conversion =
        sectionConversionService.convert(section, idPrefix, manifest, useGeneration);
    SafetyGateResult gated =
        safetyGate.evaluate(conversion.document(), EmbedContent.none());
    return new SectionResult(
        section,
        gated.document(),
        gated.report(),
        conversion.routingTrace(),
        conversion.source(),
        conversion.fixes(),
        conversion.warnings(),
        gated.chunkedEmbeds());
  }
}
