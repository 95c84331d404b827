package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element or text run. Children are referenced by identifier only; the tree is rebuilt by
 * lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Node {

  @JsonProperty("_id")
  private String id;

  private String type;
  private String tag;
  private List<String> classes;
  private List<String> children;
  private Boolean text;
  private String v;
  private NodeData data;

  public static Node textRun(String id, String value) {
    return Node.builder().id(id).text(true).v(value).build();
  }

  @JsonIgnore
  public boolean isTextRun() {
    return Boolean.TRUE.equals(text);
  }

  public boolean isType(NodeType nodeType) {
    return nodeType.label().equals(type);
  }

  public Node copy() {
    return new Node(
        id,
        type,
        tag,
        classes == null ? null : new ArrayList<>(classes),
        children == null ? null : new ArrayList<>(children),
        text,
        v,
        data == null ? null : data.copy());
  }
}
