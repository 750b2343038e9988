package com.flamingo.ai.pdftools.api.rest;

import com.flamingo.ai.pdftools.api.dto.response.ExtractTextResponse;
import com.flamingo.ai.pdftools.service.extraction.TextExtractionService;
import com.flamingo.ai.pdftools.service.upload.DocumentKind;
import com.flamingo.ai.pdftools.service.upload.UploadValidator;
import com.flamingo.ai.pdftools.service.word.PdfToWordService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for text extraction and PDF to Word conversion. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class TextExtractionController {

  private final UploadValidator uploadValidator;
  private final TextExtractionService textExtractionService;
  private final PdfToWordService pdfToWordService;

  /** Extracts the reflowed text of a PDF, falling back to OCR for scanned documents. */
  @PostMapping(value = "/extract-text", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ExtractTextResponse> extractText(
      @RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(
        ExtractTextResponse.from(
            textExtractionService.extract(uploadValidator.read(file, DocumentKind.PDF))));
  }

  /** Converts a PDF to a .docx built from its reflowed text. */
  @PostMapping(value = "/pdf-to-word", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> pdfToWord(@RequestParam("file") MultipartFile file) {
    byte[] docx = pdfToWordService.convert(uploadValidator.read(file, DocumentKind.PDF));
    return Attachments.of(docx, "output.docx", Attachments.DOCX);
  }
}
