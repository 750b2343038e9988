package com.flamingo.ai.pdftools.acquisition;

import java.util.List;

/**
 * Per-page result of text-layer extraction or OCR.
 *
 * @param pageIndex 1-based page number
 * @param status what happened to the page
 * @param text extracted text, empty unless {@code status} is {@link PageStatus#TEXT}
 * @param failure failure description for {@link PageStatus#FAILED} pages, otherwise {@code null}
 */
public record PageOutcome(int pageIndex, PageStatus status, String text, String failure) {

  public static PageOutcome text(int pageIndex, String text) {
    if (text == null || text.isBlank()) {
      return empty(pageIndex);
    }
    return new PageOutcome(pageIndex, PageStatus.TEXT, text, null);
  }

  public static PageOutcome empty(int pageIndex) {
    return new PageOutcome(pageIndex, PageStatus.EMPTY, "", null);
  }

  public static PageOutcome failed(int pageIndex, String failure) {
    return new PageOutcome(pageIndex, PageStatus.FAILED, "", failure);
  }

  public boolean hasText() {
    return status == PageStatus.TEXT;
  }

  public List<String> lines() {
    return hasText() ? text.lines().toList() : List.of();
  }
}
