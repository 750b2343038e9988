package com.flamingo.ai.pdftools.service.office;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so external-tool adapters can be tested without the
 * tools installed.
 */
public interface ProcessFactory {

  /**
   * Starts a process with stderr merged into stdout.
   *
   * @param command full command line, executable first
   * @param workingDir working directory, or {@code null} to inherit
   * @throws IOException if the process cannot be started
   */
  Process start(List<String> command, Path workingDir) throws IOException;
}
