package com.flamingo.ai.flowbridge;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.flowbridge.service.collision.CollisionDetector;
import com.flamingo.ai.flowbridge.service.graph.NoopSectionGenerator;
import com.flamingo.ai.flowbridge.service.graph.SectionGenerator;
import com.flamingo.ai.flowbridge.service.pipeline.PageConversionService;
import com.flamingo.ai.flowbridge.service.routing.CssRoutingTracer;
import com.flamingo.ai.flowbridge.service.safety.SafetyGate;
import com.flamingo.ai.flowbridge.service.token.TokenExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the application context loads with the default generation strategy, which needs no
 * external service.
 */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(PageConversionService.class)).isNotNull();
    assertThat(applicationContext.getBean(TokenExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(CssRoutingTracer.class)).isNotNull();
    assertThat(applicationContext.getBean(SafetyGate.class)).isNotNull();
    assertThat(applicationContext.getBean(CollisionDetector.class)).isNotNull();
  }

  @Test
  @DisplayName("Generation should be off unless a strategy is configured")
  void shouldUseNoopGeneratorByDefault() {
    assertThat(applicationContext.getBean(SectionGenerator.class))
        .isInstanceOf(NoopSectionGenerator.class);
  }
}
