package com.flamingo.ai.pdftools.api.rest;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/** Builds file-download responses. */
final class Attachments {

  static final MediaType PDF = MediaType.APPLICATION_PDF;
  static final MediaType ZIP = MediaType.parseMediaType("application/zip");
  static final MediaType DOCX =
      MediaType.parseMediaType(
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

  private Attachments() {}

  static ResponseEntity<byte[]> of(byte[] body, String fileName, MediaType mediaType) {
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(fileName).build().toString())
        .contentType(mediaType)
        .contentLength(body.length)
        .body(body);
  }
}
