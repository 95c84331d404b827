package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.exception.GenerationServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Generation strategy backed by the external generation service over HTTP. */
@Service
@ConditionalOnProperty(name = "flowbridge.generation.strategy", havingValue = "http")
@RequiredArgsConstructor
@Slf4j
public class HttpSectionGenerator implements SectionGenerator {

  private final GenerationServiceClient generationServiceClient;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "flowbridge.generation.http", description = "Time for remote section generation")
  @CircuitBreaker(name = "generation", fallbackMethod = "generateFallback")
  @Retry(name = "generation")
  public Optional<JsonNode> generate(SectionGenerationRequest request) {
    log.debug("Requesting generation for section {}", request.sectionName());
    GenerationServiceClient.GenerationResponse response =
        generationServiceClient.generate(request);

    if (response == null) {
      throw new GenerationServiceException("Empty response from generation service");
    }
    JsonNode document = parseDocument(response.webflowJson());
    meterRegistry.counter("flowbridge.generation.http.invocations").increment();
    return Optional.of(document);
  }

  /** Reads the serialized clipboard document. Empty objects and placeholders count as missing. */
  private JsonNode parseDocument(String webflowJson) {
    if (webflowJson == null || webflowJson.isBlank()) {
      throw new GenerationServiceException("Generation service returned no document");
    }
    JsonNode document;
    try {
      document = objectMapper.readTree(webflowJson);
    } catch (JsonProcessingException e) {
      throw new GenerationServiceException(
          "Generation service returned unparseable document: " + e.getOriginalMessage(), e);
    }
    if (document == null
        || !document.isObject()
        || document.isEmpty()
        || document.path("placeholder").asBoolean(false)) {
      throw new GenerationServiceException("Generation service returned no document");
    }
    return document;
  }

  /** Fallback when the service is unavailable: the caller uses the deterministic builder. */
  @SuppressWarnings("unused")
  Optional<JsonNode> generateFallback(SectionGenerationRequest request, Throwable t) {
    log.warn(
        "Generation service unavailable for section {}, using deterministic builder: {}",
        request.sectionName(),
        t.getMessage());
    meterRegistry.counter("flowbridge.generation.fallback", "strategy", "http").increment();
    return Optional.empty();
  }
}
