package com.flamingo.ai.pdftools.acquisition;

import java.util.List;

/** Renders document pages to images for OCR. */
public interface PageRasterizer {

  /**
   * Renders up to {@code pageCap} pages in grayscale.
   *
   * <p>Pages that fail to render are omitted; the returned list may be empty.
   */
  List<PageImage> rasterize(SourceDocument document, float dpi, int pageCap);
}
