package com.flamingo.ai.pdftools.service.upload;

import java.util.Locale;
import java.util.Set;

/** Upload categories accepted by the conversion endpoints. */
public enum DocumentKind {
  PDF("a PDF file", Set.of("application/pdf"), Set.of(".pdf")),
  WORD(
      "a Word (.doc/.docx) file",
      Set.of(
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
      Set.of(".doc", ".docx")),
  PRESENTATION(
      "a PPT/PPTX file",
      Set.of(
          "application/vnd.ms-powerpoint",
          "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
      Set.of(".ppt", ".pptx")),
  IMAGE("an image", Set.of(), Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp"));

  private final String label;
  private final Set<String> mediaTypes;
  private final Set<String> extensions;

  DocumentKind(String label, Set<String> mediaTypes, Set<String> extensions) {
    this.label = label;
    this.mediaTypes = mediaTypes;
    this.extensions = extensions;
  }

  public String label() {
    return label;
  }

  /** Whether a detected media type belongs to this kind. */
  public boolean acceptsMediaType(String mediaType) {
    if (mediaType == null) {
      return false;
    }
    if (this == IMAGE) {
      return mediaType.startsWith("image/");
    }
    return mediaTypes.contains(mediaType);
  }

  /** Whether a file name carries one of this kind's extensions. */
  public boolean acceptsFileName(String fileName) {
    if (fileName == null) {
      return false;
    }
    String lower = fileName.toLowerCase(Locale.ROOT);
    return extensions.stream().anyMatch(lower::endsWith);
  }
}
