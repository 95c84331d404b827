package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.NodeData;
import com.flamingo.ai.flowbridge.domain.xscp.NodeType;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.exception.ConversionException;
import com.flamingo.ai.flowbridge.exception.GenerationServiceException;
import com.flamingo.ai.flowbridge.service.section.Section;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Converts one section, preferring the configured generator and falling back to the
 * deterministic builder on any failure. Always returns a document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionConversionService {

  static final String PLACEHOLDER_URL = "#";
  static final String PLACEHOLDER_IMAGE = "https://placehold.co/600x400";

  private final NodeStyleGraphBuilder graphBuilder;
  private final SectionGenerator sectionGenerator;
  private final PayloadShapeValidator payloadShapeValidator;
  private final MeterRegistry meterRegistry;

  /**
   * Converts a section.
   *
   * @param section detected section
   * @param idPrefix node identifier prefix, may be blank
   * @param manifest this page's tokens
   * @param useGeneration whether to try the generator first
   * @return the candidate document and how it was produced
   */
  @Timed(value = "flowbridge.conversion.section", description = "Time to convert one section")
  public SectionConversion convert(
      Section section, String idPrefix, TokenManifest manifest, boolean useGeneration) {
    GraphBuildResult built =
        graphBuilder.build(section.htmlContent(), section.cssContent(), idPrefix, manifest);

    if (useGeneration && sectionGenerator.isAvailable()) {
      Optional<SectionConversion> generated = tryGenerate(section, idPrefix, built);
      if (generated.isPresent()) {
        meterRegistry.counter("flowbridge.conversion.generated").increment();
        return generated.get();
      }
      meterRegistry.counter("flowbridge.conversion.fallback").increment();
    }

    return new SectionConversion(
        built.document(),
        ConversionSource.DETERMINISTIC,
        List.of(),
        built.warnings(),
        built.routingTrace(),
        built.embedCss());
  }

  /**
   * Patches link and image nodes missing their required data with placeholders.
   *
   * @return one fix description per patched node
   */
  public List<String> patchRequiredData(XscpDocument document) {
    List<String> fixes = new ArrayList<>();
    for (Node node : document.getPayload().getNodes()) {
      if (node == null || node.isTextRun()) {
        continue;
      }
      if (node.isType(NodeType.LINK)) {
        NodeData data = dataOf(node);
        if (data.getLink() == null) {
          data.setLink(new NodeData.Link("external", PLACEHOLDER_URL, null));
          fixes.add("Added placeholder link to node " + node.getId());
        }
      } else if (node.isType(NodeType.IMAGE)) {
        NodeData data = dataOf(node);
        NodeData.ImageAttr attr = data.getAttr();
        if (attr == null || attr.src() == null || attr.src().isBlank()) {
          String alt = attr == null || attr.alt() == null ? "" : attr.alt();
          data.setAttr(new NodeData.ImageAttr(PLACEHOLDER_IMAGE, alt, "lazy"));
          fixes.add("Added placeholder image to node " + node.getId());
        }
      }
    }
    return fixes;
  }

  // ---- private helpers ----

  private Optional<SectionConversion> tryGenerate(
      Section section, String idPrefix, GraphBuildResult built) {
    SectionGenerationRequest request =
        new SectionGenerationRequest(
            section.htmlContent(), section.cssContent(), idPrefix, section.name());
    try {
      Optional<JsonNode> candidate = sectionGenerator.generate(request);
      if (candidate.isEmpty()) {
        log.debug("No generated document for section {}", section.name());
        return Optional.empty();
      }
      XscpDocument document = payloadShapeValidator.read(candidate.get(), section.name());
      List<String> fixes = patchRequiredData(document);
      log.debug("Using generated document for section {} ({} fixes)", section.name(), fixes.size());
      return Optional.of(
          new SectionConversion(
              document,
              ConversionSource.GENERATED,
              fixes,
              List.of(),
              built.routingTrace(),
              built.embedCss()));
    } catch (ConversionException | GenerationServiceException e) {
      log.warn(
          "Generated document rejected for section {}, using deterministic builder: {}",
          section.name(),
          e.getMessage());
      return Optional.empty();
    }
  }

  private static NodeData dataOf(Node node) {
    if (node.getData() == null) {
      node.setData(NodeData.builder().tag(node.getTag()).text(false).build());
    }
    return node.getData();
  }
}
