package com.flamingo.ai.pdftools.service.extraction;

import com.flamingo.ai.pdftools.acquisition.AcquisitionResult;
import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.acquisition.TextAcquisitionService;
import com.flamingo.ai.pdftools.text.FormattedDocument;
import com.flamingo.ai.pdftools.text.TextFormatter;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Acquires a document's text and reflows it into paragraphs, headings and lists. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractionService {

  private final TextAcquisitionService acquisitionService;
  private final TextFormatter textFormatter;

  @Timed(value = "text.extract", description = "Time to extract and format document text")
  public ExtractedText extract(SourceDocument document) {
    AcquisitionResult result = acquisitionService.acquire(document);
    FormattedDocument formatted = textFormatter.format(result.lines());
    log.info(
        "Extracted {} blocks from {} via {}",
        formatted.blocks().size(),
        document.fileName(),
        result.path());
    return new ExtractedText(formatted.text(), result.path(), result.pages().size());
  }

  /** Same pipeline as {@link #extract}, keeping the block structure. */
  public FormattedDocument extractFormatted(SourceDocument document) {
    AcquisitionResult result = acquisitionService.acquire(document);
    return textFormatter.format(result.lines());
  }
}
