package com.flamingo.ai.flowbridge.service.safety;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * Findings of one gate run.
 *
 * @param status ok, warn or block
 * @param fatalIssues problems that block pasting
 * @param autoFixes changes the gate made
 * @param warnings problems left for the caller
 * @param embedSize per-type embed size findings
 */
public record SafetyReport(
    SafetyStatus status,
    List<String> fatalIssues,
    List<String> autoFixes,
    List<String> warnings,
    EmbedSize embedSize) {

  public SafetyReport {
    fatalIssues = List.copyOf(fatalIssues);
    autoFixes = List.copyOf(autoFixes);
    warnings = List.copyOf(warnings);
  }

  @JsonIgnore
  public boolean isBlocked() {
    return status == SafetyStatus.BLOCK;
  }

  /**
   * Embed size findings. Sizes are UTF-8 bytes.
   *
   * @param limitBytes hard limit per embed
   * @param html measured HTML embed size
   * @param css measured CSS embed size
   * @param js measured JS embed size
   * @param errors over-limit embeds that block
   * @param warnings embeds near the limit or needing chunking
   */
  public record EmbedSize(
      int limitBytes, int html, int css, int js, List<String> errors, List<String> warnings) {

    public EmbedSize {
      errors = List.copyOf(errors);
      warnings = List.copyOf(warnings);
    }

    public static EmbedSize empty(int limitBytes) {
      return new EmbedSize(limitBytes, 0, 0, 0, List.of(), List.of());
    }
  }
}
