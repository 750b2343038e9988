package com.flamingo.ai.pdftools.exception;

/** Thrown when an upload is malformed, unreadable, of the wrong type or has bad parameters. */
public class InvalidDocumentException extends RuntimeException {

  private final String userMessage;

  public InvalidDocumentException(String message) {
    super(message);
    this.userMessage = message;
  }

  public InvalidDocumentException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = message;
  }

  public InvalidDocumentException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
