package com.flamingo.ai.flowbridge.exception;

/** Exception thrown when the section generation service fails. */
public class GenerationServiceException extends RuntimeException {

  public GenerationServiceException(String message) {
    super(message);
  }

  public GenerationServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
