package com.flamingo.ai.pdftools.service.office;

import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.ConversionException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Office to PDF conversion through headless LibreOffice.
 *
 * <p>Word documents go through an ODT intermediate before PDF export. Every conversion gets its
 * own temp directory and LibreOffice user profile, so concurrent requests do not share state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OfficeConversionService {

  static final String TOOL = "libreoffice";
  static final String WRITER_PDF_FILTER =
      "pdf:writer_pdf_Export:EmbedStandardFonts=true;ReduceImageResolution=false";
  static final String IMPRESS_PDF_FILTER = "pdf:impress_pdf_Export";

  private final ExternalProcessRunner processRunner;
  private final PdfToolsProperties properties;
  private final MeterRegistry meterRegistry;

  @Timed(value = "office.word_to_pdf", description = "Time to convert Word to PDF")
  public byte[] wordToPdf(SourceDocument document) {
    try (TempWorkspace workspace = TempWorkspace.create(TOOL)) {
      Path input = workspace.write("input" + extension(document, ".docx"), document.bytes());
      Path odt = convert(workspace, input, "odt", "odt");
      Path pdf = convert(workspace, odt, WRITER_PDF_FILTER, "pdf");
      return finish(pdf, "word-to-pdf");
    } catch (IOException e) {
      throw new ConversionException(TOOL, "Word conversion failed: " + e.getMessage(), e);
    }
  }

  @Timed(value = "office.ppt_to_pdf", description = "Time to convert PowerPoint to PDF")
  public byte[] presentationToPdf(SourceDocument document) {
    try (TempWorkspace workspace = TempWorkspace.create(TOOL)) {
      Path input = workspace.write("input" + extension(document, ".pptx"), document.bytes());
      Path pdf = convert(workspace, input, IMPRESS_PDF_FILTER, "pdf");
      return finish(pdf, "ppt-to-pdf");
    } catch (IOException e) {
      throw new ConversionException(TOOL, "Presentation conversion failed: " + e.getMessage(), e);
    }
  }

  private Path convert(TempWorkspace workspace, Path input, String target, String outputExt) {
    Path outDir = workspace.directory();
    List<String> command = new ArrayList<>();
    command.add(properties.getOffice().getCommand());
    command.add("-env:UserInstallation=" + outDir.resolve("profile").toUri());
    command.add("--headless");
    command.add("--norestore");
    command.add("--nologo");
    command.add("--invisible");
    command.add("--convert-to");
    command.add(target);
    command.add("--outdir");
    command.add(outDir.toString());
    command.add(input.toString());
    processRunner.run(TOOL, command, outDir, properties.getOffice().getTimeout());

    Path output = outDir.resolve(baseName(input) + "." + outputExt);
    if (!Files.isRegularFile(output)) {
      throw new ConversionException(TOOL, "LibreOffice produced no ." + outputExt + " output");
    }
    return output;
  }

  private byte[] finish(Path pdf, String operation) throws IOException {
    byte[] bytes = Files.readAllBytes(pdf);
    meterRegistry.counter("conversion.completed", "tool", operation).increment();
    log.info("{} produced {} bytes", operation, bytes.length);
    return bytes;
  }

  private static String extension(SourceDocument document, String fallback) {
    String name = document.fileName().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) {
      return fallback;
    }
    String ext = name.substring(dot);
    return ext.matches("\\.[a-z0-9]{1,5}") ? ext : fallback;
  }

  private static String baseName(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? name : name.substring(0, dot);
  }
}
