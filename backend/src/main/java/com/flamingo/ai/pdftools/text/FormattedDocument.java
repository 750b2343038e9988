package com.flamingo.ai.pdftools.text;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Final output of the reflow pipeline: rendered blocks in document order.
 *
 * <p>{@link #text()} is the caller-facing string, blocks separated by exactly one blank line.
 *
 * @param blocks rendered blocks, never containing blank text
 */
public record FormattedDocument(List<RenderedBlock> blocks) {

  public static final String BLOCK_SEPARATOR = "\n\n";

  public FormattedDocument {
    blocks = List.copyOf(blocks);
  }

  public String text() {
    return blocks.stream()
        .map(RenderedBlock::text)
        .collect(Collectors.joining(BLOCK_SEPARATOR))
        .strip();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }
}
