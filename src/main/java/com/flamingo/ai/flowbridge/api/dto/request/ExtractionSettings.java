package com.flamingo.ai.flowbridge.api.dto.request;

import com.flamingo.ai.flowbridge.service.section.CssExtractionOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-request CSS extraction overrides. Null fields keep the configured default. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionSettings {

  private Boolean includeRoot;
  private Boolean includeReset;
  private Boolean includeBody;
  private Boolean includeHtml;
  private Boolean includeImg;
  private Boolean includeKeyframes;
  private Boolean dedupe;

  /** Applies these overrides on top of {@code defaults}. */
  public CssExtractionOptions applyTo(CssExtractionOptions defaults) {
    return new CssExtractionOptions(
        pick(includeRoot, defaults.includeRoot()),
        pick(includeReset, defaults.includeReset()),
        pick(includeBody, defaults.includeBody()),
        pick(includeHtml, defaults.includeHtml()),
        pick(includeImg, defaults.includeImg()),
        pick(includeKeyframes, defaults.includeKeyframes()),
        pick(dedupe, defaults.dedupe()));
  }

  private static boolean pick(Boolean override, boolean fallback) {
    return override == null ? fallback : override;
  }
}
