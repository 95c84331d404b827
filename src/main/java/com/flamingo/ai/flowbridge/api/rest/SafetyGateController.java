package com.flamingo.ai.flowbridge.api.rest;

import com.flamingo.ai.flowbridge.api.dto.request.SafetyGateRequest;
import com.flamingo.ai.flowbridge.api.dto.request.TraceRoutingRequest;
import com.flamingo.ai.flowbridge.api.dto.response.SafetyGateResponse;
import com.flamingo.ai.flowbridge.service.routing.CssRoutingTracer;
import com.flamingo.ai.flowbridge.service.routing.RoutingTrace;
import com.flamingo.ai.flowbridge.service.safety.SafetyGate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for validating documents and tracing CSS routing. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SafetyGateController {

  private final SafetyGate safetyGate;
  private final CssRoutingTracer cssRoutingTracer;

  /** Runs the safety gate. A blocked report is still a 200 response. */
  @PostMapping("/safety-gate")
  public ResponseEntity<SafetyGateResponse> evaluate(
      @Valid @RequestBody SafetyGateRequest request) {
    return ResponseEntity.ok(
        SafetyGateResponse.from(
            safetyGate.evaluate(request.getDocument(), request.embedContent())));
  }

  @PostMapping("/routing/trace")
  public ResponseEntity<RoutingTrace> trace(@Valid @RequestBody TraceRoutingRequest request) {
    return ResponseEntity.ok(cssRoutingTracer.trace(request.getCss()));
  }
}
