package com.flamingo.ai.pdftools.acquisition;

/** Result category of reading one page. */
public enum PageStatus {
  TEXT,
  EMPTY,
  FAILED
}
