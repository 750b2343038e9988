package com.flamingo.ai.pdftools.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("POST", "/merge-pdf");
  }

  private double errors(String type) {
    return meterRegistry.counter("api_errors_total", "error_type", type).count();
  }

  @Test
  @DisplayName("should map invalid documents to 400 with the user message")
  void shouldHandleInvalidDocument() {
    ResponseEntity<ApiError> response =
        handler.handleInvalidDocument(
            new InvalidDocumentException("internal detail", "All files must be PDF", null),
            request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    ApiError body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.getCode()).isEqualTo(ApiError.INVALID_DOCUMENT);
    assertThat(body.getMessage()).isEqualTo("All files must be PDF");
    assertThat(body.getPath()).isEqualTo("/merge-pdf");
    assertThat(body.getErrorId()).hasSize(8);
    assertThat(body.getTimestamp()).isNotNull();
    assertThat(errors("invalid_document")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should map conversion failures to 500 tagged by tool")
  void shouldHandleConversion() {
    ResponseEntity<ApiError> response =
        handler.handleConversion(new ConversionException("libreoffice", "exit 77"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getMessage()).isEqualTo("Conversion failed");
    assertThat(errors("conversion_libreoffice")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should map oversized uploads to 413")
  void shouldHandleUploadTooLarge() {
    ResponseEntity<ApiError> fromValidator =
        handler.handleUploadTooLarge(
            new UploadTooLargeException(30_000_000L, 26_214_400L), request);
    ResponseEntity<ApiError> fromMultipart =
        handler.handleMaxUploadSize(new MaxUploadSizeExceededException(52_428_800L), request);

    assertThat(fromValidator.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
    assertThat(fromValidator.getBody().getMessage()).contains("25.00 MB");
    assertThat(fromMultipart.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
    assertThat(errors("upload_too_large")).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should map acquisition failures to 422")
  void shouldHandleTextAcquisition() {
    ResponseEntity<ApiError> response =
        handler.handleTextAcquisition(
            new TextAcquisitionException("timeout", "Text recognition timed out", null), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().getMessage()).isEqualTo("Text recognition timed out");
  }

  @Test
  @DisplayName("should hide unexpected error details")
  void shouldHandleGeneric() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("secret internals"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INTERNAL_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret");
    assertThat(errors("internal_error")).isEqualTo(1.0);
  }
}
