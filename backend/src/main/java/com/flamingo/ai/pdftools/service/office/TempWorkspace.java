package com.flamingo.ai.pdftools.service.office;

import com.flamingo.ai.pdftools.exception.ConversionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

/** Per-request temporary directory, deleted with its contents on {@link #close()}. */
@Slf4j
public final class TempWorkspace implements AutoCloseable {

  private final Path directory;

  private TempWorkspace(Path directory) {
    this.directory = directory;
  }

  public static TempWorkspace create(String tool) {
    try {
      return new TempWorkspace(Files.createTempDirectory("pdftools-" + tool + "-"));
    } catch (IOException e) {
      throw new ConversionException(tool, "Cannot create temp directory: " + e.getMessage(), e);
    }
  }

  public Path directory() {
    return directory;
  }

  public Path write(String fileName, byte[] content) throws IOException {
    return Files.write(directory.resolve(fileName), content);
  }

  @Override
  public void close() {
    try {
      FileSystemUtils.deleteRecursively(directory);
    } catch (IOException e) {
      log.warn("Failed to delete temp directory {}: {}", directory, e.getMessage());
    }
  }
}
