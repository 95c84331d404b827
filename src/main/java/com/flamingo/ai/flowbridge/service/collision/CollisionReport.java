package com.flamingo.ai.flowbridge.service.collision;

import java.util.List;

/**
 * Result of comparing a document with a destination.
 *
 * @param existingClasses payload style names already declared at the destination
 * @param missingVariables variable references the destination cannot satisfy
 * @param suggestedActions one action per existing class
 * @param warnings checks that could not run
 */
public record CollisionReport(
    List<String> existingClasses,
    List<String> missingVariables,
    List<CollisionAction> suggestedActions,
    List<String> warnings) {

  public CollisionReport {
    existingClasses = List.copyOf(existingClasses);
    missingVariables = List.copyOf(missingVariables);
    suggestedActions = List.copyOf(suggestedActions);
    warnings = List.copyOf(warnings);
  }

  public boolean hasCollisions() {
    return !existingClasses.isEmpty() || !missingVariables.isEmpty();
  }
}
