package com.flamingo.ai.flowbridge.service.section;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;

/** Which base rules accompany a section's class rules, and whether identical rules collapse. */
public record CssExtractionOptions(
    boolean includeRoot,
    boolean includeReset,
    boolean includeBody,
    boolean includeHtml,
    boolean includeImg,
    boolean includeKeyframes,
    boolean dedupe) {

  public static CssExtractionOptions from(FlowbridgeConfig.Extraction extraction) {
    return new CssExtractionOptions(
        extraction.isIncludeRoot(),
        extraction.isIncludeReset(),
        extraction.isIncludeBody(),
        extraction.isIncludeHtml(),
        extraction.isIncludeImg(),
        extraction.isIncludeKeyframes(),
        extraction.isDedupe());
  }

  public static CssExtractionOptions defaults() {
    return from(new FlowbridgeConfig.Extraction());
  }
}
