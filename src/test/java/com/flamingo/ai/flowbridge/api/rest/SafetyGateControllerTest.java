package com.flamingo.ai.flowbridge.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.exception.GlobalExceptionHandler;
import com.flamingo.ai.flowbridge.service.css.CssRuleScanner;
import com.flamingo.ai.flowbridge.service.graph.PayloadShapeValidator;
import com.flamingo.ai.flowbridge.service.routing.BreakpointMapper;
import com.flamingo.ai.flowbridge.service.routing.CssRoutingTracer;
import com.flamingo.ai.flowbridge.service.safety.EmbedChunker;
import com.flamingo.ai.flowbridge.service.safety.SafetyGate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("SafetyGateController Integration Tests")
class SafetyGateControllerTest {

  private static final String CLEAN_DOCUMENT =
      """
      {
        "type": "@webflow/XscpData",
        "payload": {
          "nodes": [
            {"_id": "root", "type": "Block", "tag": "div",
             "classes": ["hero"], "children": ["t1"]},
            {"_id": "t1", "text": true, "v": "Hello"}
          ],
          "styles": [
            {"_id": "hero", "type": "class", "name": "hero", "styleLess": "color: red;"}
          ]
        }
      }
      """;

  private MockMvc mockMvc;
  private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    FlowbridgeConfig config = new FlowbridgeConfig();
    meterRegistry = new SimpleMeterRegistry();
    SafetyGate safetyGate =
        new SafetyGate(
            config,
            objectMapper,
            new PayloadShapeValidator(objectMapper),
            new EmbedChunker(),
            meterRegistry);
    CssRoutingTracer tracer =
        new CssRoutingTracer(config, new CssRuleScanner(), new BreakpointMapper());
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SafetyGateController(safetyGate, tracer))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should report ok for a clean document")
  void shouldReportOk_whenDocumentClean() throws Exception {
    mockMvc
        .perform(
            post("/api/safety-gate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"document\": " + CLEAN_DOCUMENT + "}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.report.status").value("ok"))
        .andExpect(jsonPath("$.report.fatalIssues").isEmpty())
        .andExpect(jsonPath("$.sanitizationApplied").value(false))
        .andExpect(jsonPath("$.document.payload.nodes[0]._id").value("root"));
  }

  @Test
  @DisplayName("Should return a blocked report rather than an error for a wrong shape")
  void shouldReportBlock_whenPayloadMissing() throws Exception {
    mockMvc
        .perform(
            post("/api/safety-gate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"document\": {\"type\": \"@webflow/XscpData\"}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.report.status").value("block"))
        .andExpect(jsonPath("$.report.fatalIssues[0]").value("Missing payload object"));
  }

  @Test
  @DisplayName("Should measure embeds sent alongside the document")
  void shouldMeasureEmbeds() throws Exception {
    mockMvc
        .perform(
            post("/api/safety-gate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"document\": "
                        + CLEAN_DOCUMENT
                        + ", \"embeds\": {\"css\": \".a { color: red; }\"}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.report.embedSize.css").value(Matchers.greaterThan(0)))
        .andExpect(jsonPath("$.report.embedSize.limitBytes").value(51200));
  }

  @Test
  @DisplayName("Should return 400 when the document is missing")
  void shouldReturnBadRequest_whenDocumentMissing() throws Exception {
    mockMvc
        .perform(post("/api/safety-gate").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.message").value("document: Document is required"));
  }

  @Test
  @DisplayName("Should return 400 when the body is not JSON")
  void shouldReturnBadRequest_whenBodyNotJson() throws Exception {
    mockMvc
        .perform(
            post("/api/safety-gate").contentType(MediaType.APPLICATION_JSON).content("{nope"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Request body is not valid JSON"));
  }

  @Test
  @DisplayName("Should trace a class rule to native output")
  void shouldTraceNativeRule() throws Exception {
    mockMvc
        .perform(
            post("/api/routing/trace")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"css\": \".hero { color: red; }\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary.totalRules").value(1))
        .andExpect(jsonPath("$.summary.nativeRules").value(1))
        .andExpect(jsonPath("$.rules[0].selector").value(".hero"));
  }
}
