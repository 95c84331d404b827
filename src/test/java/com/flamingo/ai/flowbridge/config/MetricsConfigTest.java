package com.flamingo.ai.flowbridge.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.graph.PayloadShapeValidator;
import com.flamingo.ai.flowbridge.service.safety.EmbedChunker;
import com.flamingo.ai.flowbridge.service.safety.EmbedContent;
import com.flamingo.ai.flowbridge.service.safety.SafetyGate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

@DisplayName("MetricsConfig Tests")
class MetricsConfigTest {

  @Test
  @DisplayName("Should record the safety gate timer through the timed aspect")
  void shouldRecordTimedSafetyGate() {
    MeterRegistry registry = new SimpleMeterRegistry();
    ObjectMapper objectMapper = new ObjectMapper();
    SafetyGate gate =
        new SafetyGate(
            new FlowbridgeConfig(),
            objectMapper,
            new PayloadShapeValidator(objectMapper),
            new EmbedChunker(),
            registry);
    AspectJProxyFactory factory = new AspectJProxyFactory(gate);
    factory.setProxyTargetClass(true);
    factory.addAspect(new MetricsConfig().timedAspect(registry));
    SafetyGate timed = factory.getProxy();

    timed.evaluate(XscpDocument.empty(), EmbedContent.none());

    Timer timer = registry.find("flowbridge.safety.gate").timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isEqualTo(1);
  }
}
