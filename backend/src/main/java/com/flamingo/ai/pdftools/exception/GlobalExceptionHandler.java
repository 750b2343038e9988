package com.flamingo.ai.pdftools.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidDocumentException.class)
  public ResponseEntity<ApiError> handleInvalidDocument(
      InvalidDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_document");
    String errorId = generateErrorId();
    log.warn("Invalid document [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, ApiError.INVALID_DOCUMENT, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(TextAcquisitionException.class)
  public ResponseEntity<ApiError> handleTextAcquisition(
      TextAcquisitionException ex, HttpServletRequest request) {

    incrementErrorCounter("text_acquisition");
    String errorId = generateErrorId();
    log.error("Text acquisition failed [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ApiError.TEXT_ACQUISITION_FAILED,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(ConversionException.class)
  public ResponseEntity<ApiError> handleConversion(
      ConversionException ex, HttpServletRequest request) {

    incrementErrorCounter("conversion_" + ex.getTool());
    String errorId = generateErrorId();
    log.error("Conversion failed [{}] in {}: {}", errorId, ex.getTool(), ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.CONVERSION_FAILED,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(UploadTooLargeException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      UploadTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        ApiError.UPLOAD_TOO_LARGE,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_too_large");
    String errorId = generateErrorId();
    log.warn("Upload rejected by multipart limit [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        ApiError.UPLOAD_TOO_LARGE,
        "Upload exceeds the maximum allowed size",
        errorId,
        request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        errorId,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String code, String message, String errorId, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
