package com.flamingo.ai.pdftools.text;

/**
 * Output text of a single {@link Block} after reflow.
 *
 * @param role role of the source block
 * @param text rendered text; bullet blocks hold one item per line
 */
public record RenderedBlock(LineRole role, String text) {}
