package com.flamingo.ai.flowbridge.service.pipeline;

import com.flamingo.ai.flowbridge.service.safety.SafetyReport;
import com.flamingo.ai.flowbridge.service.safety.SafetyStatus;
import com.flamingo.ai.flowbridge.service.token.FontReport;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import java.util.List;

/**
 * Whole-page conversion output.
 *
 * @param title page title
 * @param tokens token manifest scoped to this page
 * @param fonts detected fonts
 * @param sections per-section results in source order
 * @param scriptReport budget findings for the page's inline scripts
 */
public record PageConversion(
    String title,
    TokenManifest tokens,
    FontReport fonts,
    List<SectionResult> sections,
    SafetyReport scriptReport) {

  public PageConversion {
    sections = List.copyOf(sections);
  }

  /** Worst status across sections and the script budget. */
  public SafetyStatus overallStatus() {
    SafetyStatus worst = scriptReport.status();
    for (SectionResult result : sections) {
      if (result.safetyReport().status().compareTo(worst) > 0) {
        worst = result.safetyReport().status();
      }
    }
    return worst;
  }
}
