package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Node/style payload of a clipboard document. Assets and interactions pass through untouched. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class XscpPayload {

  @Builder.Default private List<Node> nodes = new ArrayList<>();
  @Builder.Default private List<Style> styles = new ArrayList<>();
  @Builder.Default private List<JsonNode> assets = new ArrayList<>();
  @Builder.Default private List<JsonNode> ix1 = new ArrayList<>();
  @Builder.Default private Ix2 ix2 = new Ix2();

  public XscpPayload copy() {
    List<Node> nodeCopies = new ArrayList<>();
    if (nodes != null) {
      nodes.forEach(node -> nodeCopies.add(node == null ? null : node.copy()));
    }
    List<Style> styleCopies = new ArrayList<>();
    if (styles != null) {
      styles.forEach(style -> styleCopies.add(style == null ? null : style.copy()));
    }
    return new XscpPayload(
        nodeCopies,
        styleCopies,
        Ix2.copyAll(assets),
        Ix2.copyAll(ix1),
        ix2 == null ? new Ix2() : ix2.copy());
  }
}
