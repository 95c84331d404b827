package com.flamingo.ai.flowbridge.service.token;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Font detection outcome.
 *
 * @param fonts detected families in discovery order
 * @param checklist one setup item per family
 * @param summary one-line human summary
 */
public record FontReport(List<DetectedFont> fonts, List<ChecklistItem> checklist, String summary) {

  public FontReport {
    fonts = List.copyOf(fonts);
    checklist = List.copyOf(checklist);
  }

  /**
   * Setup step for one family.
   *
   * @param family family name
   * @param source origin
   * @param status whether the family is already available at the destination
   * @param action what the user has to do, if anything
   */
  public record ChecklistItem(String family, FontSource source, Status status, String action) {}

  /** Availability of a family at the destination. */
  public enum Status {
    AVAILABLE,
    MISSING;

    @JsonValue
    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
