package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Modern interaction slot. Carried verbatim. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Ix2 {

  @Builder.Default private List<JsonNode> interactions = new ArrayList<>();
  @Builder.Default private List<JsonNode> events = new ArrayList<>();
  @Builder.Default private List<JsonNode> actionLists = new ArrayList<>();

  public Ix2 copy() {
    return new Ix2(copyAll(interactions), copyAll(events), copyAll(actionLists));
  }

  static List<JsonNode> copyAll(List<JsonNode> source) {
    List<JsonNode> copies = new ArrayList<>();
    if (source != null) {
      source.forEach(item -> copies.add(item == null ? null : item.deepCopy()));
    }
    return copies;
  }
}
