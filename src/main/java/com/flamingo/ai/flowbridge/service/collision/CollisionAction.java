package com.flamingo.ai.flowbridge.service.collision;

/**
 * Suggested handling of one colliding class.
 *
 * @param className payload style name
 * @param action what to do with it
 * @param reason why
 */
public record CollisionAction(String className, Resolution action, String reason) {

  /** Resolution kinds. The existing destination style always wins. */
  public enum Resolution {
    SKIP
  }
}
