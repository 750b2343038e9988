package com.flamingo.ai.pdftools.acquisition;

import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chooses between the embedded text layer and OCR for a document.
 *
 * <p>The text layer is always tried first. OCR runs only when no page of the text layer has
 * non-blank text; each stage runs at most once and nothing is retried. A document that cannot be
 * opened fails immediately without falling back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextAcquisitionService {

  private final TextLayerExtractor textLayerExtractor;
  private final OcrTextExtractor ocrTextExtractor;
  private final MeterRegistry meterRegistry;

  @Timed(value = "text.acquisition.duration", description = "Time to acquire document text")
  public AcquisitionResult acquire(SourceDocument document) {
    List<PageOutcome> textLayer = textLayerExtractor.extract(document);
    if (textLayer.stream().anyMatch(PageOutcome::hasText)) {
      log.debug("Using text layer of {} ({} pages)", document.fileName(), textLayer.size());
      return complete(AcquisitionPath.TEXT_LAYER, textLayer);
    }

    log.info(
        "No text layer in {} ({} pages), falling back to OCR",
        document.fileName(),
        textLayer.size());
    return complete(AcquisitionPath.OCR, ocrTextExtractor.recognize(document));
  }

  private AcquisitionResult complete(AcquisitionPath path, List<PageOutcome> pages) {
    List<String> lines = new ArrayList<>();
    for (PageOutcome page : pages) {
      lines.addAll(page.lines());
    }
    AcquisitionResult result = new AcquisitionResult(path, lines, pages);
    if (result.failedPages() > 0) {
      log.warn("{} of {} pages failed during {}", result.failedPages(), pages.size(), path);
    }
    meterRegistry.counter("text.acquisition", "path", path.tag()).increment();
    return result;
  }
}
