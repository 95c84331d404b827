package com.flamingo.ai.flowbridge.service.collision;

/** Operations a destination can perform for collision checks. */
public enum DestinationCapability {
  STYLE_LISTING,
  VARIABLE_LISTING
}
