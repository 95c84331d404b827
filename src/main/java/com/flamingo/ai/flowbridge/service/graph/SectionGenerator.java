package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Strategy for producing a candidate document with an external generator.
 *
 * <p>Implementations are selected by {@code flowbridge.generation.strategy}. An empty result means
 * the caller must use the deterministic builder.
 */
public interface SectionGenerator {

  /**
   * Generates a candidate document for one section.
   *
   * @param request section markup, CSS and naming
   * @return the raw candidate JSON, or empty when generation is unavailable or failed
   */
  Optional<JsonNode> generate(SectionGenerationRequest request);

  /** False for the strategy that never generates. */
  default boolean isAvailable() {
    return true;
  }
}
