package com.flamingo.ai.pdftools.service.pdf;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Sorted, de-duplicated 1-based page numbers.
 *
 * @param pages selected pages in ascending order
 */
public record PageSelection(List<Integer> pages) {

  public PageSelection {
    pages = List.copyOf(pages);
  }

  public static PageSelection all(int totalPages) {
    return new PageSelection(IntStream.rangeClosed(1, totalPages).boxed().toList());
  }

  public boolean isEmpty() {
    return pages.isEmpty();
  }
}
