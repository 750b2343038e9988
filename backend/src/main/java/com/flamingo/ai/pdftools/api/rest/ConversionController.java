package com.flamingo.ai.pdftools.api.rest;

import com.flamingo.ai.pdftools.service.image.ImageConversionService;
import com.flamingo.ai.pdftools.service.office.OfficeConversionService;
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

/** REST controller for format conversions: Office to PDF and PDF to and from images. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class ConversionController {

  private final UploadValidator uploadValidator;
  private final OfficeConversionService officeConversionService;
  private final ImageConversionService imageConversionService;

  @PostMapping(value = "/word-to-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> wordToPdf(@RequestParam("file") MultipartFile file) {
    byte[] pdf = officeConversionService.wordToPdf(uploadValidator.read(file, DocumentKind.WORD));
    return Attachments.of(pdf, "output.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/ppt-to-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> presentationToPdf(@RequestParam("file") MultipartFile file) {
    byte[] pdf =
        officeConversionService.presentationToPdf(
            uploadValidator.read(file, DocumentKind.PRESENTATION));
    return Attachments.of(pdf, "output.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/jpg-to-pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> imagesToPdf(@RequestParam("files") List<MultipartFile> files) {
    byte[] pdf =
        imageConversionService.imagesToPdf(
            uploadValidator.readMatching(files, DocumentKind.IMAGE));
    return Attachments.of(pdf, "output.pdf", Attachments.PDF);
  }

  @PostMapping(value = "/pdf-to-jpg", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> pdfToJpg(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "pages", required = false) String pages) {
    byte[] zip =
        imageConversionService.pdfToJpg(uploadValidator.read(file, DocumentKind.PDF), pages);
    return Attachments.of(zip, "images.zip", Attachments.ZIP);
  }
}
