package com.flamingo.ai.pdftools.service.archive;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Builds an in-memory zip archive; entries keep insertion order. */
public class ZipArchive {

  private final Map<String, byte[]> entries = new LinkedHashMap<>();

  public ZipArchive add(String name, byte[] content) {
    if (entries.putIfAbsent(name, content) != null) {
      throw new IllegalArgumentException("Duplicate zip entry: " + name);
    }
    return this;
  }

  public int size() {
    return entries.size();
  }

  public byte[] toByteArray() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out)) {
      for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
        zip.putNextEntry(new ZipEntry(entry.getKey()));
        zip.write(entry.getValue());
        zip.closeEntry();
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write zip archive", e);
    }
    return out.toByteArray();
  }
}
