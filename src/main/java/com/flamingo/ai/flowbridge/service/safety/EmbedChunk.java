package com.flamingo.ai.flowbridge.service.safety;

/** One piece of a split embed. Sizes are UTF-8 bytes. */
public record EmbedChunk(int index, String content, int sizeBytes, EmbedType type) {}
