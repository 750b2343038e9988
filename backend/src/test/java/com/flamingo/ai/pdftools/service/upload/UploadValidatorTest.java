package com.flamingo.ai.pdftools.service.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.InvalidDocumentException;
import com.flamingo.ai.pdftools.exception.UploadTooLargeException;
import com.flamingo.ai.pdftools.testutil.TestPdfs;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

@DisplayName("UploadValidator")
class UploadValidatorTest {

  private PdfToolsProperties properties;
  private UploadValidator validator;

  @BeforeEach
  void setUp() {
    properties = new PdfToolsProperties();
    validator = new UploadValidator(properties);
  }

  private static MockMultipartFile file(String name, byte[] content) {
    return new MockMultipartFile("file", name, "application/octet-stream", content);
  }

  private static byte[] zip() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out)) {
      zip.putNextEntry(new ZipEntry("word/document.xml"));
      zip.write("<w:document/>".getBytes(StandardCharsets.UTF_8));
      zip.closeEntry();
    }
    return out.toByteArray();
  }

  @Test
  @DisplayName("should accept a real PDF")
  void shouldAcceptPdf() {
    byte[] pdf = TestPdfs.withPages("hello");

    SourceDocument document = validator.read(file("doc.pdf", pdf), DocumentKind.PDF);

    assertThat(document.fileName()).isEqualTo("doc.pdf");
    assertThat(document.bytes()).isEqualTo(pdf);
  }

  @Test
  @DisplayName("should reject content that is not a PDF whatever its name")
  void shouldRejectPdf_whenContentDiffers() {
    MockMultipartFile text = file("notes.txt", "plain text".getBytes(StandardCharsets.UTF_8));
    MockMultipartFile disguised = file("a.pdf", TestPdfs.png(4, 4));

    assertThatThrownBy(() -> validator.read(text, DocumentKind.PDF))
        .isInstanceOfSatisfying(
            InvalidDocumentException.class,
            e -> assertThat(e.getUserMessage()).isEqualTo("Upload a PDF file"));
    assertThatThrownBy(() -> validator.read(disguised, DocumentKind.PDF))
        .isInstanceOf(InvalidDocumentException.class);
  }

  @Test
  @DisplayName("should accept a zip container with a Word extension")
  void shouldAcceptWord_whenZipNamedDocx() throws IOException {
    SourceDocument document = validator.read(file("doc.docx", zip()), DocumentKind.WORD);

    assertThat(document.fileName()).isEqualTo("doc.docx");
  }

  @Test
  @DisplayName("should reject empty uploads")
  void shouldReject_whenEmpty() {
    assertThatThrownBy(() -> validator.read(file("a.pdf", new byte[0]), DocumentKind.PDF))
        .isInstanceOf(InvalidDocumentException.class)
        .hasMessage("No file uploaded");
    assertThatThrownBy(() -> validator.read(null, DocumentKind.PDF))
        .isInstanceOf(InvalidDocumentException.class);
  }

  @Test
  @DisplayName("should reject uploads above the limit")
  void shouldReject_whenTooLarge() {
    byte[] pdf = TestPdfs.withPages("x");

    assertThatThrownBy(
            () -> validator.read(file("a.pdf", pdf), DocumentKind.PDF, DataSize.ofBytes(10)))
        .isInstanceOfSatisfying(
            UploadTooLargeException.class, e -> assertThat(e.getLimit()).isEqualTo(10));
  }

  @Test
  @DisplayName("should apply the configured default limit to the total of a batch")
  void shouldReject_whenBatchTotalTooLarge() {
    byte[] pdf = TestPdfs.withPages("x");
    properties.getUpload().setDefaultLimit(DataSize.ofBytes(pdf.length + 1L));
    List<MultipartFile> files = List.of(file("a.pdf", pdf), file("b.pdf", pdf));

    assertThatThrownBy(() -> validator.readAll(files, DocumentKind.PDF))
        .isInstanceOf(UploadTooLargeException.class);
  }

  @Test
  @DisplayName("should reject the whole batch when one file has the wrong type")
  void shouldRejectAll_whenOneFileMismatches() {
    List<MultipartFile> files =
        List.of(file("a.pdf", TestPdfs.withPages("a")), file("b.png", TestPdfs.png(2, 2)));

    assertThatThrownBy(() -> validator.readAll(files, DocumentKind.PDF))
        .isInstanceOfSatisfying(
            InvalidDocumentException.class,
            e -> assertThat(e.getUserMessage()).isEqualTo("All files must be PDF"));
  }

  @Test
  @DisplayName("should skip files of the wrong type when reading leniently")
  void shouldSkipMismatches_whenReadingMatching() {
    List<MultipartFile> files =
        List.of(
            file("a.png", TestPdfs.png(2, 2)),
            file("b.txt", "hello".getBytes(StandardCharsets.UTF_8)),
            file("c.jpg", new byte[0]));

    List<SourceDocument> images = validator.readMatching(files, DocumentKind.IMAGE);

    assertThat(images).extracting(SourceDocument::fileName).containsExactly("a.png");
  }

  @Test
  @DisplayName("should require at least one file in a batch")
  void shouldReject_whenNoFiles() {
    assertThatThrownBy(() -> validator.readAll(List.of(), DocumentKind.PDF))
        .isInstanceOf(InvalidDocumentException.class)
        .hasMessage("No files uploaded");
  }
}
