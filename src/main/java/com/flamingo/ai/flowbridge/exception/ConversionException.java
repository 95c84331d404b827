package com.flamingo.ai.flowbridge.exception;

/** Exception thrown when a section cannot be converted into a usable document. */
public class ConversionException extends RuntimeException {

  private final String sectionName;

  public ConversionException(String sectionName, String message) {
    super(message);
    this.sectionName = sectionName;
  }

  public ConversionException(String sectionName, String message, Throwable cause) {
    super(message, cause);
    this.sectionName = sectionName;
  }

  public String getSectionName() {
    return sectionName;
  }
}
