package com.flamingo.ai.pdftools.service.upload;

import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.InvalidDocumentException;
import com.flamingo.ai.pdftools.exception.UploadTooLargeException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

/**
 * Reads multipart uploads into {@link SourceDocument}s after checking size and content type.
 *
 * <p>Types are detected from content with Tika, using the file name only as a hint. Office
 * formats are also accepted by extension, since container formats are not always detectable
 * from magic bytes alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadValidator {

  private static final Tika TIKA = new Tika();

  private final PdfToolsProperties properties;

  public SourceDocument read(MultipartFile file, DocumentKind kind) {
    return read(file, kind, properties.getUpload().getDefaultLimit());
  }

  public SourceDocument read(MultipartFile file, DocumentKind kind, DataSize limit) {
    if (file == null || file.isEmpty()) {
      throw new InvalidDocumentException("No file uploaded");
    }
    checkSize(file.getSize(), limit);
    SourceDocument document = toDocument(file);
    String mediaType = detect(document);
    if (!matches(kind, mediaType, document.fileName())) {
      throw new InvalidDocumentException(
          "Unsupported upload type " + mediaType + " for " + document.fileName(),
          "Upload " + kind.label(),
          null);
    }
    return document;
  }

  /** Reads every file; any file that is not of {@code kind} rejects the whole request. */
  public List<SourceDocument> readAll(List<MultipartFile> files, DocumentKind kind) {
    List<MultipartFile> uploads = requireFiles(files);
    List<SourceDocument> documents = new ArrayList<>(uploads.size());
    for (MultipartFile file : uploads) {
      SourceDocument document = toDocument(file);
      String mediaType = detect(document);
      if (!matches(kind, mediaType, document.fileName())) {
        throw new InvalidDocumentException(
            "Non-" + kind + " upload " + document.fileName() + " (" + mediaType + ")",
            "All files must be " + kind.name(),
            null);
      }
      documents.add(document);
    }
    return documents;
  }

  /** Reads every file, skipping those that are not of {@code kind}. The result may be empty. */
  public List<SourceDocument> readMatching(List<MultipartFile> files, DocumentKind kind) {
    List<MultipartFile> uploads = requireFiles(files);
    List<SourceDocument> documents = new ArrayList<>(uploads.size());
    for (MultipartFile file : uploads) {
      if (file.isEmpty()) {
        log.warn("Skipping empty upload {}", file.getOriginalFilename());
        continue;
      }
      SourceDocument document = toDocument(file);
      String mediaType = detect(document);
      if (kind.acceptsMediaType(mediaType)) {
        documents.add(document);
      } else {
        log.warn("Skipping {} upload {}: detected {}", kind, document.fileName(), mediaType);
      }
    }
    return documents;
  }

  String detect(SourceDocument document) {
    return TIKA.detect(document.bytes(), document.fileName());
  }

  private List<MultipartFile> requireFiles(List<MultipartFile> files) {
    if (files == null || files.isEmpty()) {
      throw new InvalidDocumentException("No files uploaded");
    }
    long total = files.stream().mapToLong(MultipartFile::getSize).sum();
    checkSize(total, properties.getUpload().getDefaultLimit());
    return files;
  }

  private static boolean matches(DocumentKind kind, String mediaType, String fileName) {
    if (kind.acceptsMediaType(mediaType)) {
      return true;
    }
    // Legacy and zipped office formats detect as generic containers without parsers.
    return kind != DocumentKind.PDF
        && kind != DocumentKind.IMAGE
        && kind.acceptsFileName(fileName)
        && ("application/zip".equals(mediaType)
            || "application/x-tika-msoffice".equals(mediaType)
            || "application/x-tika-ooxml".equals(mediaType)
            || "application/octet-stream".equals(mediaType));
  }

  private static void checkSize(long size, DataSize limit) {
    if (size > limit.toBytes()) {
      throw new UploadTooLargeException(size, limit.toBytes());
    }
  }

  private static SourceDocument toDocument(MultipartFile file) {
    try {
      return new SourceDocument(file.getOriginalFilename(), file.getBytes());
    } catch (IOException e) {
      throw new InvalidDocumentException("Failed to read upload: " + e.getMessage(), e);
    }
  }
}
