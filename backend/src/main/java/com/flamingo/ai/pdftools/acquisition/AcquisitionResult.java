package com.flamingo.ai.pdftools.acquisition;

import java.util.List;

/**
 * Outcome of text acquisition for a whole document.
 *
 * @param path strategy that produced {@code lines}
 * @param lines all pages' lines concatenated in page order
 * @param pages per-page outcomes of the chosen strategy, in page order
 */
public record AcquisitionResult(AcquisitionPath path, List<String> lines, List<PageOutcome> pages) {

  public AcquisitionResult {
    lines = List.copyOf(lines);
    pages = List.copyOf(pages);
  }

  public long failedPages() {
    return pages.stream().filter(p -> p.status() == PageStatus.FAILED).count();
  }
}
