package com.flamingo.ai.flowbridge.service.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

@DisplayName("GenerationServiceClient Tests")
class GenerationServiceClientTest {

  private static final String SERVICE_BODY =
      "{\"webflowJson\":\"{\\\"type\\\":\\\"@webflow/XscpData\\\","
          + "\\\"payload\\\":{\\\"nodes\\\":[],\\\"styles\\\":[]}}\"}";

  private final SectionGenerationRequest request =
      new SectionGenerationRequest("<div></div>", ".a{}", "wf", "Hero");
  private final AtomicReference<ClientRequest> sent = new AtomicReference<>();

  @Test
  @DisplayName("Should bind the serialized document from the service reply")
  void shouldBindWebflowJson() {
    GenerationServiceClient client = clientReplying(HttpStatus.OK, SERVICE_BODY);

    GenerationServiceClient.GenerationResponse response = client.generate(request);

    assertThat(response.webflowJson())
        .isEqualTo("{\"type\":\"@webflow/XscpData\",\"payload\":{\"nodes\":[],\"styles\":[]}}");
    assertThat(sent.get().method()).isEqualTo(HttpMethod.POST);
    assertThat(sent.get().url().getPath()).isEqualTo("/generate");
  }

  @Test
  @DisplayName("Should hand the parsed document to the generation strategy")
  void shouldProduceDocumentThroughGenerator() {
    HttpSectionGenerator generator =
        new HttpSectionGenerator(
            clientReplying(HttpStatus.OK, SERVICE_BODY),
            new ObjectMapper(),
            new SimpleMeterRegistry());

    Optional<JsonNode> document = generator.generate(request);

    assertThat(document).isPresent();
    assertThat(document.get().path("type").asText()).isEqualTo("@webflow/XscpData");
    assertThat(document.get().path("payload").path("styles").isArray()).isTrue();
  }

  @Test
  @DisplayName("Should bind a null document when the reply omits it")
  void shouldBindNull_whenFieldMissing() {
    GenerationServiceClient client = clientReplying(HttpStatus.OK, "{\"error\":\"quota\"}");

    assertThat(client.generate(request).webflowJson()).isNull();
  }

  @Test
  @DisplayName("Should surface non-2xx replies as WebClient exceptions")
  void shouldThrow_whenServiceErrors() {
    GenerationServiceClient client =
        clientReplying(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"down\"}");

    assertThatThrownBy(() -> client.generate(request))
        .isInstanceOf(WebClientResponseException.class);
  }

  private GenerationServiceClient clientReplying(HttpStatus status, String body) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                clientRequest -> {
                  sent.set(clientRequest);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(body)
                          .build());
                });
    return new GenerationServiceClient(new FlowbridgeConfig(), builder);
  }
}
