package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Default strategy: never generates, so every section uses the deterministic builder. */
@Service
@ConditionalOnProperty(
    name = "flowbridge.generation.strategy",
    havingValue = "none",
    matchIfMissing = true)
public class NoopSectionGenerator implements SectionGenerator {

  @Override
  public Optional<JsonNode> generate(SectionGenerationRequest request) {
    return Optional.empty();
  }

  @Override
  public boolean isAvailable() {
    return false;
  }
}
