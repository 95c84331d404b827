package com.flamingo.ai.flowbridge.service.routing;

/**
 * A media query mapped onto a supported breakpoint.
 *
 * @param original the media condition as written
 * @param mapped breakpoint name
 * @param rounded true when the query width differs from the breakpoint width
 * @param originalWidth query width in pixels
 * @param mappedWidth breakpoint width in pixels
 */
public record BreakpointMapping(
    String original, String mapped, boolean rounded, int originalWidth, int mappedWidth) {}
