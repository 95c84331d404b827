package com.flamingo.ai.flowbridge.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.service.graph.ConversionSource;
import com.flamingo.ai.flowbridge.service.routing.RoutingTrace;
import com.flamingo.ai.flowbridge.service.safety.SafetyReport;
import com.flamingo.ai.flowbridge.service.safety.SafetyStatus;
import com.flamingo.ai.flowbridge.service.section.Section;
import com.flamingo.ai.flowbridge.service.token.FontReport;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConversionMetricsListener Tests")
class ConversionMetricsListenerTest {

  private final MeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final ConversionMetricsListener listener = new ConversionMetricsListener(meterRegistry);

  private static SafetyReport report(SafetyStatus status) {
    return new SafetyReport(
        status, List.of(), List.of(), List.of(), SafetyReport.EmbedSize.empty(51_200));
  }

  private static SectionResult result(ConversionSource source, SafetyStatus status) {
    Section section = new Section("s", "S", "section", "s", "", List.of(), "");
    return new SectionResult(
        section,
        XscpDocument.empty(),
        report(status),
        RoutingTrace.empty(),
        source,
        List.of(),
        List.of(),
        List.of());
  }

  @Test
  @DisplayName("Should count pages by status and sections by source")
  void shouldCountConversions() {
    PageConversion conversion =
        new PageConversion(
            "Demo",
            TokenManifest.empty(),
            new FontReport(List.of(), List.of(), ""),
            List.of(
                result(ConversionSource.GENERATED, SafetyStatus.OK),
                result(ConversionSource.DETERMINISTIC, SafetyStatus.WARN),
                result(ConversionSource.DETERMINISTIC, SafetyStatus.OK)),
            report(SafetyStatus.OK));

    listener.onPageConverted(new PageConvertedEvent(conversion, true));

    assertThat(meterRegistry.counter("flowbridge.pages.converted", "status", "warn").count())
        .isEqualTo(1.0);
    assertThat(sections("deterministic")).isEqualTo(2.0);
    assertThat(sections("generated")).isEqualTo(1.0);
  }

  private double sections(String source) {
    return meterRegistry.counter("flowbridge.sections.converted", "source", source).count();
  }
}
