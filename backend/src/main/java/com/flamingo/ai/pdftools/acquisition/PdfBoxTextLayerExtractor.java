package com.flamingo.ai.pdftools.acquisition;

import com.flamingo.ai.pdftools.exception.InvalidDocumentException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * {@link TextLayerExtractor} backed by PDFBox's {@link PDFTextStripper}.
 *
 * <p>Pages are stripped one at a time so a page with a broken content stream fails alone.
 */
@Component
@Slf4j
public class PdfBoxTextLayerExtractor implements TextLayerExtractor {

  @Override
  public List<PageOutcome> extract(SourceDocument document) {
    try (PDDocument pdf = PdfDocuments.open(document)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      int pageCount = pdf.getNumberOfPages();
      List<PageOutcome> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        pages.add(extractPage(pdf, stripper, page));
      }
      return pages;
    } catch (IOException e) {
      // close() failure after a successful read
      throw new InvalidDocumentException("Failed to read PDF: " + e.getMessage(), e);
    }
  }

  private PageOutcome extractPage(PDDocument pdf, PDFTextStripper stripper, int page) {
    try {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      return PageOutcome.text(page, stripper.getText(pdf));
    } catch (IOException | RuntimeException e) {
      log.warn("Text layer extraction failed for page {}: {}", page, e.getMessage());
      return PageOutcome.failed(page, e.getMessage());
    }
  }
}
