package com.flamingo.ai.pdftools.exception;

/** Exception thrown when neither the text layer nor OCR could produce text for a document. */
public class TextAcquisitionException extends RuntimeException {

  private final String userMessage;

  public TextAcquisitionException(String message) {
    super(message);
    this.userMessage = "Could not extract text from document";
  }

  public TextAcquisitionException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Could not extract text from document";
  }

  public TextAcquisitionException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
