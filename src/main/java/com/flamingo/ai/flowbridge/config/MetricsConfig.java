package com.flamingo.ai.flowbridge.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring for the conversion service. Counters are registered where they are incremented;
 * this class only adds what annotations need.
 */
@Configuration
public class MetricsConfig {

  /**
   * Backs {@code @Timed} so the page and section conversion, safety gate and generation timers
   * ({@code flowbridge.conversion.*}, {@code flowbridge.safety.gate},
   * {@code flowbridge.generation.*}) are recorded.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
