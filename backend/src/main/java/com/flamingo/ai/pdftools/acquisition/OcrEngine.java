package com.flamingo.ai.pdftools.acquisition;

import com.flamingo.ai.pdftools.exception.OcrException;
import java.awt.image.BufferedImage;

/** Optical character recognition over a single page image. */
public interface OcrEngine {

  String recognize(BufferedImage image) throws OcrException;
}
