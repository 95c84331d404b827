package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Element-specific node data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeData {

  private String tag;
  private Boolean text;
  private List<Attribute> xattr;
  private Link link;
  private ImageAttr attr;
  private Embed embed;

  public NodeData copy() {
    return new NodeData(
        tag,
        text,
        xattr == null ? null : new ArrayList<>(xattr),
        link,
        attr,
        embed == null ? null : embed.copy());
  }

  /**
   * Arbitrary attribute preserved verbatim.
   *
   * @param name attribute name
   * @param value attribute value
   */
  public record Attribute(String name, String value) {}

  /**
   * Anchor data.
   *
   * @param mode link mode (external, section, email, phone)
   * @param url target URL
   * @param target optional browsing context
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Link(String mode, String url, String target) {}

  /**
   * Image attributes.
   *
   * @param src image source
   * @param alt alternative text
   * @param loading loading hint
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ImageAttr(String src, String alt, String loading) {}

  /** Raw embed payload. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Embed {
    private String type = "html";
    private EmbedMeta meta = new EmbedMeta();

    public static Embed html(String html) {
      return new Embed("html", new EmbedMeta(html, false, false, false, false));
    }

    public Embed copy() {
      return new Embed(type, meta == null ? null : meta.copy());
    }
  }

  /** Embed flags as the consumer expects them. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class EmbedMeta {
    private String html = "";
    private boolean div;
    private boolean iframe;
    private boolean script;
    private boolean compilable;

    public EmbedMeta copy() {
      return new EmbedMeta(html, div, iframe, script, compilable);
    }
  }
}
