package com.flamingo.ai.pdftools.service.pdf;

import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.ConversionException;
import com.flamingo.ai.pdftools.service.office.ExternalProcessRunner;
import com.flamingo.ai.pdftools.service.office.TempWorkspace;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Re-renders a PDF through Ghostscript's {@code pdfwrite} device to shrink it. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfCompressionService {

  static final String TOOL = "ghostscript";

  private final ExternalProcessRunner processRunner;
  private final PdfToolsProperties properties;
  private final MeterRegistry meterRegistry;

  @Timed(value = "pdf.compress", description = "Time to compress a PDF")
  public byte[] compress(SourceDocument document) {
    PdfToolsProperties.Compression compression = properties.getCompression();
    try (TempWorkspace workspace = TempWorkspace.create(TOOL)) {
      Path input = workspace.write("input.pdf", document.bytes());
      Path output = workspace.directory().resolve("compressed.pdf");
      processRunner.run(
          TOOL,
          command(compression, input, output),
          workspace.directory(),
          compression.getTimeout());
      if (!Files.isRegularFile(output) || Files.size(output) == 0) {
        throw new ConversionException(TOOL, "Ghostscript produced no output");
      }
      byte[] bytes = Files.readAllBytes(output);
      meterRegistry.counter("conversion.completed", "tool", "compress").increment();
      log.info(
          "Compressed {} from {} to {} bytes", document.fileName(), document.size(), bytes.length);
      return bytes;
    } catch (IOException e) {
      throw new ConversionException(TOOL, "Compression failed: " + e.getMessage(), e);
    }
  }

  static List<String> command(PdfToolsProperties.Compression compression, Path input, Path output) {
    return List.of(
        compression.getCommand(),
        "-sDEVICE=pdfwrite",
        "-dCompatibilityLevel=" + compression.getCompatibilityLevel(),
        "-dPDFSETTINGS=" + compression.getPdfSettings(),
        "-dNOPAUSE",
        "-dQUIET",
        "-dBATCH",
        "-sOutputFile=" + output,
        input.toString());
  }
}
