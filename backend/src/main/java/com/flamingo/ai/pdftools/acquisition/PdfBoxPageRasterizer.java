package com.flamingo.ai.pdftools.acquisition;

import com.flamingo.ai.pdftools.exception.TextAcquisitionException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

/** {@link PageRasterizer} using PDFBox's {@link PDFRenderer} in grayscale. */
@Component
@Slf4j
public class PdfBoxPageRasterizer implements PageRasterizer {

  @Override
  public List<PageImage> rasterize(SourceDocument document, float dpi, int pageCap) {
    try (PDDocument pdf = PdfDocuments.open(document)) {
      PDFRenderer renderer = new PDFRenderer(pdf);
      int pages = Math.min(pdf.getNumberOfPages(), pageCap);
      if (pdf.getNumberOfPages() > pageCap) {
        log.info(
            "Rasterizing first {} of {} pages of {}",
            pageCap,
            pdf.getNumberOfPages(),
            document.fileName());
      }
      List<PageImage> images = new ArrayList<>(pages);
      for (int i = 0; i < pages; i++) {
        try {
          BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.GRAY);
          images.add(new PageImage(i + 1, image));
        } catch (IOException | RuntimeException e) {
          log.warn("Rasterization failed for page {}: {}", i + 1, e.getMessage());
        }
      }
      return images;
    } catch (IOException e) {
      throw new TextAcquisitionException("Cannot rasterize " + document.fileName(), e);
    }
  }
}
