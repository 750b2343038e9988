package com.flamingo.ai.pdftools.service.word;

import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.exception.ConversionException;
import com.flamingo.ai.pdftools.service.extraction.TextExtractionService;
import com.flamingo.ai.pdftools.text.FormattedDocument;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Converts a PDF to .docx from its reflowed text. Layout and images are not carried over. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfToWordService {

  private final TextExtractionService extractionService;
  private final WordDocumentBuilder documentBuilder;
  private final MeterRegistry meterRegistry;

  @Timed(value = "word.pdf_to_word", description = "Time to convert PDF to Word")
  public byte[] convert(SourceDocument document) {
    FormattedDocument formatted = extractionService.extractFormatted(document);
    try {
      byte[] docx = documentBuilder.build(formatted);
      meterRegistry.counter("conversion.completed", "tool", "pdf-to-word").increment();
      log.info("Built .docx with {} blocks from {}", formatted.blocks().size(), document.fileName());
      return docx;
    } catch (IOException e) {
      throw new ConversionException("poi", "Failed to write .docx: " + e.getMessage(), e);
    }
  }
}
