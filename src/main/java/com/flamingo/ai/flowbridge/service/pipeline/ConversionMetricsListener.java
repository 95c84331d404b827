package com.flamingo.ai.flowbridge.service.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Counts finished page conversions by overall status and section source. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversionMetricsListener {

  private final MeterRegistry meterRegistry;

  @EventListener
  public void onPageConverted(PageConvertedEvent event) {
    PageConversion conversion = event.conversion();
    meterRegistry
        .counter("flowbridge.pages.converted", "status", conversion.overallStatus().label())
        .increment();
    conversion
        .sections()
        .forEach(
            section ->
                meterRegistry
                    .counter("flowbridge.sections.converted", "source", section.source().label())
                    .increment());
    log.info(
        "Converted page '{}': {} section(s), status {}",
        conversion.title(),
        conversion.sections().size(),
        conversion.overallStatus().label());
  }
}
