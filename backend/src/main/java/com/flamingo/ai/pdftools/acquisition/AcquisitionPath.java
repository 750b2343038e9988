package com.flamingo.ai.pdftools.acquisition;

import java.util.Locale;

/** Which strategy produced a document's text. */
public enum AcquisitionPath {
  TEXT_LAYER,
  OCR;

  /** Tag value used in metrics. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
