package com.flamingo.ai.pdftools.acquisition;

import java.util.List;

/** Reads the embedded text layer of a document, one page at a time. */
public interface TextLayerExtractor {

  /**
   * Extracts every page of the document.
   *
   * @param document the document to read
   * @return one outcome per page, in page order
   * @throws com.flamingo.ai.pdftools.exception.InvalidDocumentException if the document cannot be
   *     opened at all
   */
  List<PageOutcome> extract(SourceDocument document);
}
