package com.flamingo.ai.flowbridge.service.routing;

/** A rewrite applied to a declaration on its way to a native style. */
public record PropertyTransform(String from, String to, String reason) {}
