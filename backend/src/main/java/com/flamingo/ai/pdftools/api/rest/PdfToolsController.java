package com.flamingo.ai.pdftools.api.rest;

import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.service.pdf.PdfCompressionService;
import com.flamingo.ai.pdftools.service.pdf.PdfOperationsService;
import com.flamingo.ai.pdftools.service.upload.DocumentKind;
import com.flamingo.ai.pdftools.service.upload.UploadValidator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for structural PDF operations. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class PdfToolsController {

  private final UploadValidator uploadValidator;
  private final PdfOperationsService pdfOperationsService;
  private final PdfCompressionService pdfCompressionService;
  private final PdfToolsProperties properties;

  @PostMapping(value = "/merge-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> merge(@RequestParam("files") List<MultipartFile> files) {
    byte[] merged = pdfOperationsService.merge(uploadValidator.readAll(files, DocumentKind.PDF));
    return Attachments.of(merged, "merged.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/split-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> split(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "ranges", required = false) String ranges) {
    byte[] zip = pdfOperationsService.split(uploadValidator.read(file, DocumentKind.PDF), ranges);
    return Attachments.of(zip, "split.zip", Attachments.ZIP);
  }

  @PostMapping(value = "/rotate-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> rotate(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "angle", defaultValue = "90") int angle) {
    byte[] rotated =
        pdfOperationsService.rotate(uploadValidator.read(file, DocumentKind.PDF), angle);
    return Attachments.of(rotated, "rotated.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/compress-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> compress(@RequestParam("file") MultipartFile file) {
    byte[] compressed =
        pdfCompressionService.compress(
            uploadValidator.read(
                file, DocumentKind.PDF, properties.getUpload().getCompressLimit()));
    return Attachments.of(compressed, "compressed.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/protect-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> protect(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "password", required = false) String password) {
    byte[] protectedPdf =
        pdfOperationsService.protect(uploadValidator.read(file, DocumentKind.PDF), password);
    return Attachments.of(protectedPdf, "protected.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/unlock-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> unlock(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "password", defaultValue = "") String password) {
    byte[] unlocked =
        pdfOperationsService.unlock(uploadValidator.read(file, DocumentKind.PDF), password);
    return Attachments.of(unlocked, "unlocked.pdf", Attachments.PDF);
  }
}
