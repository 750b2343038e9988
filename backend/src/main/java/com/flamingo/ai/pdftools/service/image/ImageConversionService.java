package com.flamingo.ai.pdftools.service.image;

import com.flamingo.ai.pdftools.acquisition.PdfDocuments;
import com.flamingo.ai.pdftools.acquisition.SourceDocument;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.ConversionException;
import com.flamingo.ai.pdftools.exception.InvalidDocumentException;
import com.flamingo.ai.pdftools.service.archive.ZipArchive;
import com.flamingo.ai.pdftools.service.pdf.PageRangeParser;
import com.flamingo.ai.pdftools.service.pdf.PageSelection;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

/** Conversions between PDF pages and raster images. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageConversionService {

  /** Resolution assumed for uploaded images when sizing their PDF pages. */
  static final float IMAGE_PAGE_DPI = 150f;

  static final float JPEG_QUALITY = 0.85f;
  private static final float POINTS_PER_INCH = 72f;

  private final PdfToolsProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Renders PDF pages to JPEG.
   *
   * @param pages page specification such as {@code "1,3,5-8"}; blank means every page
   * @return zip archive of {@code page_1.jpg}, {@code page_2.jpg}, ... numbered in output order
   */
  @Timed(value = "image.pdf_to_jpg", description = "Time to render PDF pages to JPEG")
  public byte[] pdfToJpg(SourceDocument document, String pages) {
    try (PDDocument pdf = PdfDocuments.open(document)) {
      int total = pdf.getNumberOfPages();
      PageSelection selection =
          pages == null || pages.isBlank()
              ? PageSelection.all(total)
              : PageRangeParser.parse(pages, total);
      if (selection.isEmpty()) {
        throw new InvalidDocumentException("No valid pages requested");
      }

      PDFRenderer renderer = new PDFRenderer(pdf);
      float dpi = properties.getRaster().getPdfToJpgDpi();
      ZipArchive zip = new ZipArchive();
      int index = 1;
      for (int page : selection.pages()) {
        BufferedImage image = renderer.renderImageWithDPI(page - 1, dpi, ImageType.RGB);
        zip.add("page_" + index++ + ".jpg", toJpeg(image));
      }
      meterRegistry.counter("conversion.completed", "tool", "pdf-to-jpg").increment();
      return zip.toByteArray();
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Failed to rasterize PDF: " + e.getMessage(), e);
    }
  }

  /**
   * Builds a PDF with one page per readable image, in upload order.
   *
   * <p>Unreadable images are skipped.
   *
   * @throws InvalidDocumentException if no image could be read
   */
  @Timed(value = "image.jpg_to_pdf", description = "Time to build a PDF from images")
  public byte[] imagesToPdf(List<SourceDocument> images) {
    try (PDDocument pdf = new PDDocument()) {
      for (SourceDocument upload : images) {
        BufferedImage image = decode(upload);
        if (image != null) {
          addImagePage(pdf, toRgb(image));
        }
      }
      if (pdf.getNumberOfPages() == 0) {
        throw new InvalidDocumentException("No valid images uploaded");
      }
      byte[] result = PdfDocuments.save(pdf);
      meterRegistry.counter("conversion.completed", "tool", "jpg-to-pdf").increment();
      return result;
    } catch (IOException e) {
      throw new ConversionException("pdfbox", "Failed to build PDF: " + e.getMessage(), e);
    }
  }

  private static BufferedImage decode(SourceDocument upload) {
    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(upload.bytes()));
      if (image == null) {
        log.warn("Skipping {}: not a readable image", upload.fileName());
      }
      return image;
    } catch (IOException e) {
      log.warn("Skipping {}: {}", upload.fileName(), e.getMessage());
      return null;
    }
  }

  private static void addImagePage(PDDocument pdf, BufferedImage image) throws IOException {
    float width = image.getWidth() * POINTS_PER_INCH / IMAGE_PAGE_DPI;
    float height = image.getHeight() * POINTS_PER_INCH / IMAGE_PAGE_DPI;
    PDPage page = new PDPage(new PDRectangle(width, height));
    pdf.addPage(page);
    PDImageXObject xObject = JPEGFactory.createFromImage(pdf, image, JPEG_QUALITY);
    try (PDPageContentStream content = new PDPageContentStream(pdf, page)) {
      content.drawImage(xObject, 0, 0, width, height);
    }
  }

  private static BufferedImage toRgb(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_INT_RGB) {
      return image;
    }
    BufferedImage rgb =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = rgb.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }
    return rgb;
  }

  private static byte[] toJpeg(BufferedImage image) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (!ImageIO.write(image, "jpg", out)) {
      throw new IOException("No JPEG writer available");
    }
    return out.toByteArray();
  }
}
