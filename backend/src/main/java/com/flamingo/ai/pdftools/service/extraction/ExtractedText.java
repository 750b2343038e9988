package com.flamingo.ai.pdftools.service.extraction;

import com.flamingo.ai.pdftools.acquisition.AcquisitionPath;

/**
 * Formatted text of a document.
 *
 * @param text reflowed text, blocks separated by one blank line
 * @param path whether the text came from the text layer or from OCR
 * @param pageCount number of pages the chosen path read
 */
public record ExtractedText(String text, AcquisitionPath path, int pageCount) {}
