package com.flamingo.ai.pdftools.acquisition;

import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.OcrException;
import java.awt.image.BufferedImage;
import lombok.RequiredArgsConstructor;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;

/**
 * {@link OcrEngine} backed by Tesseract through Tess4J.
 *
 * <p>{@link Tesseract} is not thread-safe; a fresh instance is configured for every page.
 */
@Component
@RequiredArgsConstructor
public class TesseractOcrEngine implements OcrEngine {

  private final PdfToolsProperties properties;

  @Override
  public String recognize(BufferedImage image) throws OcrException {
    try {
      return newTesseract().doOCR(image);
    } catch (TesseractException e) {
      throw new OcrException("Tesseract failed: " + e.getMessage(), e);
    } catch (LinkageError e) {
      throw new OcrException("Tesseract native library unavailable: " + e.getMessage(), e);
    }
  }

  Tesseract newTesseract() {
    PdfToolsProperties.Ocr ocr = properties.getOcr();
    Tesseract tesseract = new Tesseract();
    String datapath = ocr.getDatapath();
    if (datapath == null || datapath.isBlank()) {
      datapath = System.getenv("TESSDATA_PREFIX");
    }
    if (datapath != null && !datapath.isBlank()) {
      tesseract.setDatapath(datapath);
    }
    tesseract.setLanguage(ocr.getLanguage());
    tesseract.setOcrEngineMode(ocr.getEngineMode());
    tesseract.setPageSegMode(ocr.getPageSegMode());
    return tesseract;
  }
}
