package com.flamingo.ai.pdftools.text;

import java.util.List;

/**
 * A run of contiguous lines sharing one role, as produced by {@link BlockSegmenter}.
 *
 * <p>Heading blocks always hold exactly one line. Blank lines never form a block.
 *
 * @param role role shared by every line of the block
 * @param lines source lines in document order, untrimmed
 */
public record Block(LineRole role, List<String> lines) {

  public Block {
    if (role == LineRole.BLANK) {
      throw new IllegalArgumentException("Blank lines are separators, not blocks");
    }
    if (lines == null || lines.isEmpty()) {
      throw new IllegalArgumentException("Block must contain at least one line");
    }
    lines = List.copyOf(lines);
  }
}
