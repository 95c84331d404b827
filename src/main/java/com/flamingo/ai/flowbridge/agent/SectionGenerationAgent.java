package com.flamingo.ai.flowbridge.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent converting one page section into a clipboard document.
 *
 * <p>Returns the raw JSON text; structure is checked by the caller before use.
 */
public interface SectionGenerationAgent {

  @SystemMessage(
      """
        You convert one section of a web page into Webflow clipboard JSON.
        Reply with a single JSON object of the form
        {"type": "@webflow/XscpData", "payload": {"nodes": [...], "styles": [...],
        "assets": [], "ix1": [], "ix2": {"interactions": [], "events": [], "actionLists": []}},
        "meta": {}}.
        Nodes are flat: children are listed by "_id", never nested. Text runs are
        {"_id": ..., "text": true, "v": "..."}. Every class a node lists must be the "_id"
        of a style. Style "styleLess" strings use "property: value;" syntax without
        custom properties or !important. Prefix every node "_id" with the given prefix.
        """)
  @UserMessage(
      """
        Section: {{sectionName}}
        Identifier prefix: {{idPrefix}}

        HTML:
        {{html}}

        CSS:
        {{css}}
        """)
  String generate(
      @V("sectionName") String sectionName,
      @V("idPrefix") String idPrefix,
      @V("html") String html,
      @V("css") String css);
}
