package com.flamingo.ai.flowbridge.service.collision;

import java.util.Set;

/**
 * A live site that a document is inserted into. Implementations declare what they can list up
 * front; callers check {@link #supports} once instead of probing each call.
 */
public interface DesignerDestination {

  Set<DestinationCapability> capabilities();

  /** Names of the class styles already declared. Only called with {@code STYLE_LISTING}. */
  Set<String> listStyleNames();

  /**
   * Names of the variables already declared, with or without the leading {@code --}. Only
   * called with {@code VARIABLE_LISTING}.
   */
  Set<String> listVariableNames();

  default boolean supports(DestinationCapability capability) {
    return capabilities().contains(capability);
  }
}
