package com.flamingo.ai.pdftools.service.pdf;

import com.flamingo.ai.pdftools.acquisition.PdfDocuments;
import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.exception.ConversionException;
import com.flamingo.ai.pdftools.exception.InvalidDocumentException;
import com.flamingo.ai.pdftools.service.archive.ZipArchive;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.multipdf.Splitter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.springframework.stereotype.Service;

/** Structural PDF operations backed by PDFBox: merge, split, rotate, protect and unlock. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfOperationsService {

  static final int DEFAULT_ROTATION = 90;
  private static final int ENCRYPTION_KEY_LENGTH = 256;

  private final MeterRegistry meterRegistry;

  /** Concatenates the documents in upload order. */
  @Timed(value = "pdf.merge", description = "Time to merge PDFs")
  public byte[] merge(List<SourceDocument> documents) {
    if (documents.isEmpty()) {
      throw new InvalidDocumentException("No files uploaded");
    }
    List<PDDocument> sources = new ArrayList<>(documents.size());
    try (PDDocument merged = new PDDocument()) {
      PDFMergerUtility merger = new PDFMergerUtility();
      for (SourceDocument document : documents) {
        PDDocument source = PdfDocuments.open(document);
        sources.add(source);
        source.setAllSecurityToBeRemoved(true);
        merger.appendDocument(merged, source);
      }
      byte[] result = PdfDocuments.save(merged);
      completed("merge");
      log.info("Merged {} PDFs into {} pages", documents.size(), merged.getNumberOfPages());
      return result;
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Merge failed: " + e.getMessage(), e);
    } finally {
      sources.forEach(PdfOperationsService::closeQuietly);
    }
  }

  /**
   * Splits the selected pages into one PDF each.
   *
   * @return zip archive of {@code page_N.pdf} entries, N being the original page number
   */
  @Timed(value = "pdf.split", description = "Time to split a PDF")
  public byte[] split(SourceDocument document, String ranges) {
    if (ranges == null || ranges.isBlank()) {
      throw new InvalidDocumentException("Missing ranges parameter");
    }
    try (PDDocument pdf = PdfDocuments.open(document)) {
      pdf.setAllSecurityToBeRemoved(true);
      PageSelection selection = PageRangeParser.parse(ranges, pdf.getNumberOfPages());
      if (selection.isEmpty()) {
        throw new InvalidDocumentException("No valid pages derived from ranges");
      }
      List<PDDocument> pages = new Splitter().split(pdf);
      try {
        ZipArchive zip = new ZipArchive();
        for (int pageNumber : selection.pages()) {
          zip.add("page_" + pageNumber + ".pdf", PdfDocuments.save(pages.get(pageNumber - 1)));
        }
        completed("split");
        return zip.toByteArray();
      } finally {
        pages.forEach(PdfOperationsService::closeQuietly);
      }
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Split failed: " + e.getMessage(), e);
    }
  }

  /**
   * Rotates every page clockwise by {@code angle} degrees.
   *
   * @param angle multiple of 90, may be negative
   */
  @Timed(value = "pdf.rotate", description = "Time to rotate a PDF")
  public byte[] rotate(SourceDocument document, int angle) {
    if (angle % 90 != 0) {
      throw new InvalidDocumentException("Invalid angle: " + angle);
    }
    try (PDDocument pdf = PdfDocuments.open(document)) {
      pdf.setAllSecurityToBeRemoved(true);
      for (PDPage page : pdf.getPages()) {
        page.setRotation(Math.floorMod(page.getRotation() + angle, 360));
      }
      byte[] result = PdfDocuments.save(pdf);
      completed("rotate");
      return result;
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Rotate failed: " + e.getMessage(), e);
    }
  }

  /** Encrypts the document so that {@code password} is required to open it. */
  @Timed(value = "pdf.protect", description = "Time to protect a PDF")
  public byte[] protect(SourceDocument document, String password) {
    if (password == null || password.isEmpty()) {
      throw new InvalidDocumentException("Missing file or password");
    }
    try (PDDocument pdf = PdfDocuments.open(document)) {
      pdf.setAllSecurityToBeRemoved(true);
      StandardProtectionPolicy policy =
          new StandardProtectionPolicy(password, password, new AccessPermission());
      policy.setEncryptionKeyLength(ENCRYPTION_KEY_LENGTH);
      pdf.protect(policy);
      byte[] result = PdfDocuments.save(pdf);
      completed("protect");
      return result;
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Protect failed: " + e.getMessage(), e);
    }
  }

  /** Removes encryption, using {@code password} if the document needs one. */
  @Timed(value = "pdf.unlock", description = "Time to unlock a PDF")
  public byte[] unlock(SourceDocument document, String password) {
    PDDocument pdf;
    try {
      pdf = PdfDocuments.open(document, password);
    } catch (InvalidPasswordException e) {
      String message =
          password == null || password.isEmpty()
              ? "Password required to unlock"
              : "Wrong password";
      throw new InvalidDocumentException(message, e);
    }
    try (pdf) {
      pdf.setAllSecurityToBeRemoved(true);
      byte[] result = PdfDocuments.save(pdf);
      completed("unlock");
      return result;
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Unlock failed: " + e.getMessage(), e);
    }
  }

  private void completed(String operation) {
    meterRegistry.counter("conversion.completed", "tool", operation).increment();
  }

  private static void closeQuietly(PDDocument document) {
    try {
      document.close();
    } catch (IOException e) {
      log.debug("Failed to close PDF: {}", e.getMessage());
    }
  }
}
