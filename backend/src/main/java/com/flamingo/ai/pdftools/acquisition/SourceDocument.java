package com.flamingo.ai.pdftools.acquisition;

import java.util.Objects;

/**
 * An uploaded document handed to text acquisition.
 *
 * @param fileName original file name, used for logging only
 * @param bytes raw document content
 */
public record SourceDocument(String fileName, byte[] bytes) {

  public SourceDocument {
    Objects.requireNonNull(bytes, "bytes");
    fileName = fileName == null || fileName.isBlank() ? "upload.pdf" : fileName;
  }

  public int size() {
    return bytes.length;
  }

  @Override
  public String toString() {
    return "SourceDocument[" + fileName + ", " + bytes.length + " bytes]";
  }
}
