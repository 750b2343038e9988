package com.flamingo.ai.pdftools.exception;

/** Exception thrown when a conversion step or external tool fails. */
public class ConversionException extends RuntimeException {

  private final String tool;
  private final String userMessage;

  public ConversionException(String tool, String message) {
    super(message);
    this.tool = tool;
    this.userMessage = "Conversion failed";
  }

  public ConversionException(String tool, String message, Throwable cause) {
    super(message, cause);
    this.tool = tool;
    this.userMessage = "Conversion failed";
  }

  public String getTool() {
    return tool;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
