package com.flamingo.ai.flowbridge.service.pipeline;

/**
 * Published once a page conversion completes.
 *
 * @param conversion the finished conversion
 * @param usedGeneration whether generation was requested
 */
public record PageConvertedEvent(PageConversion conversion, boolean usedGeneration) {}
