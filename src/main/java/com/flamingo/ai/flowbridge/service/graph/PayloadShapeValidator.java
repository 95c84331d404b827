package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.exception.ConversionException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Structural shape check for candidate documents arriving as raw JSON. */
@Component
@RequiredArgsConstructor
public class PayloadShapeValidator {

  private final ObjectMapper objectMapper;

  /**
   * Lists what keeps a JSON tree from being a clipboard document.
   *
   * @return shape problems; empty when the tree has the required slots
   */
  public List<String> problems(JsonNode json) {
    List<String> problems = new ArrayList<>();
    if (json == null || !json.isObject()) {
      problems.add("Payload is not a JSON object");
      return problems;
    }
    if (!XscpDocument.TYPE.equals(json.path("type").asText(null))) {
      problems.add("Missing or wrong type, expected " + XscpDocument.TYPE);
    }
    JsonNode payload = json.get("payload");
    if (payload == null || !payload.isObject()) {
      problems.add("Missing payload object");
      return problems;
    }
    if (!payload.path("nodes").isArray()) {
      problems.add("payload.nodes must be an array");
    }
    if (!payload.path("styles").isArray()) {
      problems.add("payload.styles must be an array");
    }
    return problems;
  }

  /**
   * Reads a candidate document after checking its shape.
   *
   * @param json candidate JSON
   * @param sectionName section the candidate was generated for, used in error reports
   * @return the typed document
   * @throws ConversionException when the shape check fails or the tree does not bind
   */
  public XscpDocument read(JsonNode json, String sectionName) {
    List<String> problems = problems(json);
    if (!problems.isEmpty()) {
      throw new ConversionException(
          sectionName, "Generated document failed shape check: " + String.join("; ", problems));
    }
    try {
      return objectMapper.treeToValue(json, XscpDocument.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new ConversionException(sectionName, "Generated document does not bind", e);
    }
  }
}
