package com.flamingo.ai.flowbridge.service.graph;

/**
 * Input for a generation strategy.
 *
 * @param html section markup
 * @param css the section's CSS subset
 * @param idPrefix node identifier prefix
 * @param sectionName display name of the section
 */
public record SectionGenerationRequest(
    String html, String css, String idPrefix, String sectionName) {}
