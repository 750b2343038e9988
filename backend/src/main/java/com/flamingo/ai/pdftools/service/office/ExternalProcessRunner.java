package com.flamingo.ai.pdftools.service.office;

import com.flamingo.ai.pdftools.exception.ConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs an external command to completion under a timeout.
 *
 * <p>Output is drained on a separate thread so a chatty tool cannot block on a full pipe; only
 * the first {@value #MAX_CAPTURED_BYTES} bytes are kept for diagnostics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalProcessRunner {

  static final int MAX_CAPTURED_BYTES = 8 * 1024;
  private static final Duration DESTROY_GRACE = Duration.ofSeconds(5);
  private static final Duration DRAIN_JOIN = Duration.ofSeconds(1);

  private final ProcessFactory processFactory;

  /**
   * Runs {@code command} and waits for it to exit.
   *
   * @param tool tool name used in errors and metrics
   * @return captured output
   * @throws ConversionException if the process cannot start, times out or exits non-zero
   */
  public String run(String tool, List<String> command, Path workingDir, Duration timeout) {
    log.debug("Running {}: {}", tool, command);
    Process process;
    try {
      process = processFactory.start(command, workingDir);
    } catch (IOException e) {
      throw new ConversionException(tool, tool + " could not be started: " + e.getMessage(), e);
    }

    OutputDrain drain = new OutputDrain(process.getInputStream());
    Thread drainThread = new Thread(drain, tool + "-out");
    drainThread.setDaemon(true);
    drainThread.start();

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        destroy(process);
        throw new ConversionException(tool, tool + " timed out after " + timeout.toSeconds() + "s");
      }
      drainThread.join(DRAIN_JOIN.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      destroy(process);
      throw new ConversionException(tool, "Interrupted while waiting for " + tool, e);
    }

    int exitCode = process.exitValue();
    String output = drain.output();
    if (exitCode != 0) {
      log.warn("{} exited with {}: {}", tool, exitCode, output);
      throw new ConversionException(tool, tool + " exited with code " + exitCode);
    }
    return output;
  }

  private static void destroy(Process process) {
    process.destroy();
    try {
      if (!process.waitFor(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }

  /** Drains a stream on its own thread; appends and reads share one lock. */
  private static final class OutputDrain implements Runnable {

    private final InputStream in;
    private final byte[] captured = new byte[MAX_CAPTURED_BYTES];
    private int length;

    OutputDrain(InputStream in) {
      this.in = in;
    }

    @Override
    public void run() {
      byte[] buffer = new byte[4096];
      try (in) {
        int read;
        while ((read = in.read(buffer)) != -1) {
          append(buffer, read);
        }
      } catch (IOException e) {
        log.debug("Output drain stopped: {}", e.toString());
      }
    }

    private synchronized void append(byte[] buffer, int read) {
      int keep = Math.min(read, MAX_CAPTURED_BYTES - length);
      if (keep > 0) {
        System.arraycopy(buffer, 0, captured, length, keep);
        length += keep;
      }
    }

    synchronized String output() {
      return new String(captured, 0, length, StandardCharsets.UTF_8).strip();
    }
  }
}
