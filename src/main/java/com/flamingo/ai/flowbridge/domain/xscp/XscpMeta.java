package com.flamingo.ai.flowbridge.domain.xscp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Paste bookkeeping counters expected by the consumer. Always zero for generated documents. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class XscpMeta {

  private int unlinkedSymbolCount;
  private int droppedLinks;
  private int dynBindRemovedCount;
  private int dynListBindRemovedCount;
  private int paginationRemovedCount;

  public XscpMeta copy() {
    return new XscpMeta(
        unlinkedSymbolCount,
        droppedLinks,
        dynBindRemovedCount,
        dynListBindRemovedCount,
        paginationRemovedCount);
  }
}
