package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Top-level clipboard document: node and style lists plus opaque asset and interaction slots.
 *
 * <p>Pipeline stages never mutate a document they did not create; they work on {@link #copy()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class XscpDocument {

  public static final String TYPE = "@webflow/XscpData";

  @Builder.Default private String type = TYPE;
  @Builder.Default private XscpPayload payload = new XscpPayload();
  @Builder.Default private XscpMeta meta = new XscpMeta();

  /** Creates an empty document with every required slot present. */
  public static XscpDocument empty() {
    return XscpDocument.builder().build();
  }

  public XscpDocument copy() {
    return new XscpDocument(
        type,
        payload == null ? new XscpPayload() : payload.copy(),
        meta == null ? new XscpMeta() : meta.copy());
  }
}
