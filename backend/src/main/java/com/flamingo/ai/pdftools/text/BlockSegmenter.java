package com.flamingo.ai.pdftools.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups classified lines into {@link Block}s in a single left-to-right pass.
 *
 * <ul>
 *   <li>Blank lines are skipped; they only separate blocks.
 *   <li>Consecutive bullet items form one list block.
 *   <li>Each heading forms a block of its own.
 *   <li>Consecutive paragraph fragments form one paragraph block.
 * </ul>
 *
 * <p>Every non-blank input line lands in exactly one block and block order follows line order.
 */
public class BlockSegmenter {

  public List<Block> segment(List<ClassifiedLine> lines) {
    List<Block> blocks = new ArrayList<>();
    int i = 0;
    while (i < lines.size()) {
      ClassifiedLine current = lines.get(i);
      switch (current.role()) {
        case BLANK -> i++;
        case HEADING -> {
          blocks.add(new Block(LineRole.HEADING, List.of(current.text())));
          i++;
        }
        default -> {
          LineRole role = current.role();
          List<String> run = new ArrayList<>();
          while (i < lines.size() && lines.get(i).role() == role) {
            run.add(lines.get(i).text());
            i++;
          }
          blocks.add(new Block(role, run));
        }
      }
    }
    return blocks;
  }
}
