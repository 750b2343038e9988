package com.flamingo.ai.pdftools.service.office;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** {@link ProcessFactory} using {@link ProcessBuilder}. */
@Component
public class DefaultProcessFactory implements ProcessFactory {

  @Override
  public Process start(List<String> command, Path workingDir) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    if (workingDir != null) {
      pb.directory(workingDir.toFile());
    }
    pb.redirectErrorStream(true);
    return pb.start();
  }
}
