package com.flamingo.ai.pdftools.acquisition;

import java.awt.image.BufferedImage;

/**
 * A rendered page, tagged with its 1-based page number at rasterization time.
 *
 * @param pageIndex 1-based page number
 * @param image grayscale rendering of the page
 */
public record PageImage(int pageIndex, BufferedImage image) {}
