package com.flamingo.ai.flowbridge.service.safety;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.domain.xscp.Ix2;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.domain.xscp.XscpPayload;
import com.flamingo.ai.flowbridge.service.graph.PayloadShapeValidator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates and repairs a candidate document before export. Passes run in a fixed order over a
 * private copy, so the caller's document is never touched and a second run over the output
 * reports no further fixes.
 */
@Service
@Slf4j
public class SafetyGate {

  static final String INVALID_JSON = "Invalid JSON - cannot parse payload";

  private final FlowbridgeConfig config;
  private final ObjectMapper objectMapper;
  private final PayloadShapeValidator payloadShapeValidator;
  private final MeterRegistry meterRegistry;
  private final List<SafetyPass> passes;
  private final EmbedBudget embedBudget;
  private final EmbedHtmlSanitizer embedHtmlSanitizer = new EmbedHtmlSanitizer();

  public SafetyGate(
      FlowbridgeConfig config,
      ObjectMapper objectMapper,
      PayloadShapeValidator payloadShapeValidator,
      EmbedChunker embedChunker,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.objectMapper = objectMapper;
    this.payloadShapeValidator = payloadShapeValidator;
    this.meterRegistry = meterRegistry;
    this.passes =
        List.of(
            new StructuralSanitationPass(config, embedHtmlSanitizer),
            new IdentityIntegrityPass(),
            new CycleBreakingPass(),
            new NestingDepthPass(config.getSafety().getDepth()),
            new ReferentialIntegrityPass(config.getSafety().getMissingStylePolicy()));
    this.embedBudget = new EmbedBudget(config.getSafety().getEmbed(), embedChunker);
  }

  /** Runs the gate on raw JSON text. Unparseable text gives a blocked result. */
  public SafetyGateResult evaluate(String json, EmbedContent embeds) {
    if (json == null || json.isBlank()) {
      return blocked(List.of(INVALID_JSON));
    }
    JsonNode tree;
    try {
      tree = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.debug("Safety gate input is not JSON: {}", e.getOriginalMessage());
      return blocked(List.of(INVALID_JSON));
    }
    return evaluate(tree, embeds);
  }

  /** Runs the gate on a JSON tree after the structural shape check. */
  public SafetyGateResult evaluate(JsonNode json, EmbedContent embeds) {
    List<String> problems = payloadShapeValidator.problems(json);
    if (!problems.isEmpty()) {
      return blocked(problems);
    }
    XscpDocument document;
    try {
      document = objectMapper.treeToValue(json, XscpDocument.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.debug("Safety gate input does not bind: {}", e.getMessage());
      return blocked(List.of("Payload does not match the document structure: " + e.getMessage()));
    }
    return evaluate(document, embeds);
  }

  /**
   * Runs every pass over a copy of the document.
   *
   * @param document candidate document, left unchanged
   * @param embeds raw embeds travelling with the document
   * @return sanitized copy, report and any embed chunks
   */
  @Timed(value = "flowbridge.safety.gate", description = "Time to run the safety gate")
  public SafetyGateResult evaluate(XscpDocument document, EmbedContent embeds) {
    SafetyFindings findings = new SafetyFindings();
    XscpDocument working = document == null ? XscpDocument.empty() : document.copy();
    normalize(working, findings);

    for (SafetyPass pass : passes) {
      int fixesBefore = findings.autoFixes.size();
      pass.apply(working, findings);
      int applied = findings.autoFixes.size() - fixesBefore;
      log.debug("Safety pass {} applied {} fix(es)", pass.name(), applied);
    }
    EmbedContent cleanedEmbeds =
        sanitizeEmbeds(embeds == null ? EmbedContent.none() : embeds, findings);
    EmbedBudget.Measurement measurement = embedBudget.measure(working, cleanedEmbeds, findings);

    SafetyReport report =
        new SafetyReport(
            findings.status(),
            findings.fatalIssues,
            findings.autoFixes,
            findings.warnings,
            new SafetyReport.EmbedSize(
                config.getSafety().getEmbed().getHardLimitBytes(),
                measurement.size(EmbedType.HTML),
                measurement.size(EmbedType.CSS),
                measurement.size(EmbedType.JS),
                findings.embedErrors,
                findings.embedWarnings));
    record(report);
    return new SafetyGateResult(
        working, report, !findings.autoFixes.isEmpty(), cleanedEmbeds, measurement.chunked());
  }

  // ---- private helpers ----

  private EmbedContent sanitizeEmbeds(EmbedContent embeds, SafetyFindings findings) {
    EmbedHtmlSanitizer.Sanitized html = embedHtmlSanitizer.sanitize(embeds.html());
    html.changes().forEach(change -> findings.fix("HTML embed: " + change));
    html.warnings().forEach(warning -> findings.warn("HTML embed: " + warning));
    return html.changed() ? new EmbedContent(html.html(), embeds.css(), embeds.js()) : embeds;
  }

  /** Fills missing slots and drops null entries so the passes can assume a complete shape. */
  private static void normalize(XscpDocument document, SafetyFindings findings) {
    if (document.getType() == null) {
      document.setType(XscpDocument.TYPE);
    }
    if (document.getPayload() == null) {
      document.setPayload(new XscpPayload());
    }
    XscpPayload payload = document.getPayload();
    if (payload.getNodes() == null) {
      payload.setNodes(new ArrayList<>());
    }
    if (payload.getStyles() == null) {
      payload.setStyles(new ArrayList<>());
    }
    if (payload.getAssets() == null) {
      payload.setAssets(new ArrayList<>());
    }
    if (payload.getIx1() == null) {
      payload.setIx1(new ArrayList<>());
    }
    if (payload.getIx2() == null) {
      payload.setIx2(new Ix2());
    }
    if (payload.getNodes().removeIf(Objects::isNull)) {
      findings.fix("Removed null node entries");
    }
    if (payload.getStyles().removeIf(Objects::isNull)) {
      findings.fix("Removed null style entries");
    }
    for (Style style : payload.getStyles()) {
      if (style.getChildren() == null) {
        style.setChildren(new ArrayList<>());
      }
      if (style.getVariants() == null) {
        style.setVariants(new LinkedHashMap<>());
      }
    }
  }

  private SafetyGateResult blocked(List<String> fatalIssues) {
    SafetyReport report =
        new SafetyReport(
            SafetyStatus.BLOCK,
            fatalIssues,
            List.of(),
            List.of(),
            SafetyReport.EmbedSize.empty(config.getSafety().getEmbed().getHardLimitBytes()));
    record(report);
    return new SafetyGateResult(
        XscpDocument.empty(), report, false, EmbedContent.none(), List.of());
  }

  private void record(SafetyReport report) {
    meterRegistry
        .counter("flowbridge.safety.status", "status", report.status().label())
        .increment();
    if (!report.autoFixes().isEmpty()) {
      meterRegistry.counter("flowbridge.safety.fixes").increment(report.autoFixes().size());
    }
    log.debug(
        "Safety gate finished: status={}, fatal={}, fixes={}, warnings={}",
        report.status(),
        report.fatalIssues().size(),
        report.autoFixes().size(),
        report.warnings().size());
  }
}
