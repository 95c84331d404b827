package com.flamingo.ai.flowbridge.service.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.agent.SectionGenerationAgent;
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

/**
 * Generation strategy backed by an OpenAI chat model through LangChain4j. Select with {@code
 * flowbridge.generation.strategy=llm}.
 */
@Service
@ConditionalOnProperty(name = "flowbridge.generation.strategy", havingValue = "llm")
@RequiredArgsConstructor
@Slf4j
public class LlmSectionGenerator implements SectionGenerator {

  private final SectionGenerationAgent agent;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "flowbridge.generation.llm", description = "Time for LLM section generation")
  @CircuitBreaker(name = "generation", fallbackMethod = "generateFallback")
  @Retry(name = "generation")
  public Optional<JsonNode> generate(SectionGenerationRequest request) {
    log.debug("Generating section {} with LLM", request.sectionName());
    String reply =
        agent.generate(request.sectionName(), request.idPrefix(), request.html(), request.css());
    if (reply == null || reply.isBlank()) {
      throw new GenerationServiceException("LLM returned an empty reply");
    }
    try {
      JsonNode document = objectMapper.readTree(reply);
      meterRegistry.counter("flowbridge.generation.llm.invocations").increment();
      return Optional.of(document);
    } catch (JsonProcessingException e) {
      throw new GenerationServiceException("LLM reply is not valid JSON", e);
    }
  }

  /** Fallback when the model is unavailable: the caller uses the deterministic builder. */
  @SuppressWarnings("unused")
  Optional<JsonNode> generateFallback(SectionGenerationRequest request, Throwable t) {
    log.warn(
        "LLM generation failed for section {}, using deterministic builder: {}",
        request.sectionName(),
        t.getMessage());
    meterRegistry.counter("flowbridge.generation.fallback", "strategy", "llm").increment();
    return Optional.empty();
  }
}
