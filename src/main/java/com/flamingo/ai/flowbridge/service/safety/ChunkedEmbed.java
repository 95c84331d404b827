package com.flamingo.ai.flowbridge.service.safety;

import java.util.List;

/** An over-limit embed split into paste-sized chunks. */
public record ChunkedEmbed(EmbedType type, int originalSizeBytes, List<EmbedChunk> chunks) {

  public ChunkedEmbed {
    chunks = List.copyOf(chunks);
  }
}
