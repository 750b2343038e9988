package com.flamingo.ai.pdftools.exception;

/** Recognition of a single page failed. Never propagates past the OCR stage. */
public class OcrException extends Exception {

  public OcrException(String message) {
    super(message);
  }

  public OcrException(String message, Throwable cause) {
    super(message, cause);
  }
}
