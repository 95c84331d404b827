package com.flamingo.ai.flowbridge.service.graph;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the external section generation service. */
@Component
@ConditionalOnProperty(name = "flowbridge.generation.strategy", havingValue = "http")
@Slf4j
public class GenerationServiceClient {

  private final WebClient webClient;
  private final String path;
  private final int readTimeoutMs;

  @Autowired
  public GenerationServiceClient(FlowbridgeConfig flowbridgeConfig) {
    this(flowbridgeConfig, WebClient.builder());
  }

  GenerationServiceClient(FlowbridgeConfig flowbridgeConfig, WebClient.Builder builder) {
    FlowbridgeConfig.Generation generation = flowbridgeConfig.getGeneration();
    this.path = generation.getPath();
    this.readTimeoutMs = generation.getReadTimeoutMs();
    this.webClient =
        builder
            .baseUrl(generation.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
            .build();
    log.info("Generation service client initialized: baseUrl={}", generation.getBaseUrl());
  }

  /**
   * Posts one section to the generation service.
   *
   * @param request section markup, CSS and naming
   * @return the service response; non-2xx statuses surface as WebClient exceptions
   */
  public GenerationResponse generate(SectionGenerationRequest request) {
    var body =
        new GenerationRequest(
            request.html(), request.css(), request.idPrefix(), request.sectionName());
    return webClient
        .post()
        .uri(path)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(GenerationResponse.class)
        .timeout(Duration.ofMillis(readTimeoutMs))
        .block();
  }

  record GenerationRequest(String html, String css, String idPrefix, String sectionName) {}

  /**
   * Generation service reply. {@code webflowJson} is the candidate clipboard document serialized
   * as a JSON string, or null when the service produced nothing.
   */
  public record GenerationResponse(String webflowJson) {}
}
