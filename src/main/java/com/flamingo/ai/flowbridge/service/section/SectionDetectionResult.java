package com.flamingo.ai.flowbridge.service.section;

import java.util.List;

/** Sections in source order plus page-level context gathered during detection. */
public record SectionDetectionResult(
    String title, List<Section> sections, String stylesheet, List<String> scripts) {

  public SectionDetectionResult {
    sections = List.copyOf(sections);
    scripts = List.copyOf(scripts);
  }

  /** Inline scripts joined as one embed payload. */
  public String scriptContent() {
    return String.join("\n\n", scripts);
  }
}
