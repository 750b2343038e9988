package com.flamingo.ai.pdftools.exception;

import java.util.Locale;

/** Exception thrown when an upload exceeds the size limit of the tool it was sent to. */
public class UploadTooLargeException extends RuntimeException {

  private final long size;
  private final long limit;

  public UploadTooLargeException(long size, long limit) {
    super("Upload of " + size + " bytes exceeds limit of " + limit + " bytes");
    this.size = size;
    this.limit = limit;
  }

  public long getSize() {
    return size;
  }

  public long getLimit() {
    return limit;
  }

  public String getUserMessage() {
    return String.format(
        Locale.ROOT, "Total upload size exceeds allowed %.2f MB.", limit / (1024.0 * 1024.0));
  }
}
