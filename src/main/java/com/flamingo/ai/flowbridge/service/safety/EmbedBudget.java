package com.flamingo.ai.flowbridge.service.safety;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.NodeType;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pass 6. Measures each embed on its own against the soft and hard limits. Sizes of different
 * embed types are never added together; every embed node is measured as a separate HTML embed.
 */
final class EmbedBudget {

  private final FlowbridgeConfig.Safety.Embed limits;
  private final EmbedChunker chunker;

  EmbedBudget(FlowbridgeConfig.Safety.Embed limits, EmbedChunker chunker) {
    this.limits = limits;
    this.chunker = chunker;
  }

  /**
   * Largest measured size per type and the chunks produced for over-limit embeds.
   *
   * @param largest largest embed of each type in UTF-8 bytes
   * @param chunked chunked embeds, empty unless chunking is enabled
   */
  record Measurement(Map<EmbedType, Integer> largest, List<ChunkedEmbed> chunked) {

    int size(EmbedType type) {
      return largest.getOrDefault(type, 0);
    }
  }

  Measurement measure(XscpDocument document, EmbedContent embeds, SafetyFindings findings) {
    Map<EmbedType, Integer> largest = new EnumMap<>(EmbedType.class);
    List<ChunkedEmbed> chunked = new ArrayList<>();
    for (EmbedType type : EmbedType.values()) {
      String content = embeds.get(type);
      if (content != null && !content.isEmpty()) {
        check(type.displayName() + " embed", type, content, largest, chunked, findings);
      }
    }
    for (Node node : document.getPayload().getNodes()) {
      String html = embedHtml(node);
      if (html != null && !html.isEmpty()) {
        String label = "HTML embed node " + node.getId();
        check(label, EmbedType.HTML, html, largest, chunked, findings);
      }
    }
    return new Measurement(largest, chunked);
  }

  // ---- private helpers ----

  private void check(
      String label,
      EmbedType type,
      String content,
      Map<EmbedType, Integer> largest,
      List<ChunkedEmbed> chunked,
      SafetyFindings findings) {
    int bytes = Utf8.encodedLength(content);
    largest.merge(type, bytes, Math::max);
    if (bytes >= limits.getHardLimitBytes()) {
      if (limits.isChunkingEnabled()) {
        ChunkedEmbed chunks = chunker.chunk(type, content, limits.getChunkSizeBytes());
        chunked.add(chunks);
        findings.embedWarning(
            label
                + " is "
                + kilobytes(bytes)
                + ", over the "
                + kilobytes(limits.getHardLimitBytes())
                + " limit; needs chunking into "
                + chunks.chunks().size()
                + " parts");
      } else {
        findings.embedError(
            label
                + " is "
                + kilobytes(bytes)
                + ", over the "
                + kilobytes(limits.getHardLimitBytes())
                + " limit");
      }
    } else if (bytes >= limits.getSoftLimitBytes()) {
      findings.embedWarning(
          label
              + " is "
              + kilobytes(bytes)
              + ", approaching the "
              + kilobytes(limits.getHardLimitBytes())
              + " limit");
    }
  }

  private static String embedHtml(Node node) {
    if (!node.isType(NodeType.HTML_EMBED)
        || node.getData() == null
        || node.getData().getEmbed() == null
        || node.getData().getEmbed().getMeta() == null) {
      return null;
    }
    return node.getData().getEmbed().getMeta().getHtml();
  }

  private static String kilobytes(int bytes) {
    return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
  }
}
