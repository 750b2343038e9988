package com.flamingo.ai.pdftools.service.pdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.ConversionException;
import com.flamingo.ai.pdftools.service.office.ExternalProcessRunner;
import com.flamingo.ai.pdftools.testutil.FakeProcess;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PdfCompressionService")
class PdfCompressionServiceTest {

  private final PdfToolsProperties properties = new PdfToolsProperties();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Test
  @DisplayName("should build the Ghostscript pdfwrite command")
  void shouldBuildCommand() {
    List<String> command =
        PdfCompressionService.command(
            properties.getCompression(), Path.of("/tmp/in.pdf"), Path.of("/tmp/out.pdf"));

    assertThat(command)
        .containsExactly(
            "gs",
            "-sDEVICE=pdfwrite",
            "-dCompatibilityLevel=1.4",
            "-dPDFSETTINGS=/ebook",
            "-dNOPAUSE",
            "-dQUIET",
            "-dBATCH",
            "-sOutputFile=" + Path.of("/tmp/out.pdf"),
            Path.of("/tmp/in.pdf").toString());
  }

  @Test
  @DisplayName("should return the file Ghostscript writes")
  void shouldReturnCompressedBytes() {
    ExternalProcessRunner runner =
        new ExternalProcessRunner(
            (command, dir) -> {
              String output = command.get(7).substring("-sOutputFile=".length());
              try {
                Files.write(Path.of(output), new byte[] {9, 9, 9});
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
              return FakeProcess.exiting(0, "");
            });
    PdfCompressionService service = new PdfCompressionService(runner, properties, meterRegistry);

    byte[] result = service.compress(new SourceDocument("big.pdf", new byte[100]));

    assertThat(result).containsExactly(9, 9, 9);
    assertThat(meterRegistry.counter("conversion.completed", "tool", "compress").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should fail when Ghostscript produces no output")
  void shouldThrow_whenOutputMissing() {
    ExternalProcessRunner runner =
        new ExternalProcessRunner((command, dir) -> FakeProcess.exiting(0, ""));
    PdfCompressionService service = new PdfCompressionService(runner, properties, meterRegistry);

    assertThatThrownBy(() -> service.compress(new SourceDocument("big.pdf", new byte[10])))
        .isInstanceOf(ConversionException.class)
        .hasMessageContaining("no output");
  }
}
