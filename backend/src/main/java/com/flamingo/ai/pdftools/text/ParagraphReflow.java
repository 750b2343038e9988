package com.flamingo.ai.pdftools.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders {@link Block}s back into readable text.
 *
 * <ul>
 *   <li>Bullet blocks keep one item per line; markers are rewritten according to the configured
 *       {@link BulletMarkerPolicy}.
 *   <li>Headings are emitted trimmed with their casing untouched.
 *   <li>Paragraph blocks are flowed into a single line: each fragment is trimmed, fragments are
 *       joined with one space and runs of spaces are collapsed.
 * </ul>
 */
public class ParagraphReflow {

  private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");

  private final LinePatterns patterns;

  public ParagraphReflow(LinePatterns patterns) {
    this.patterns = patterns;
  }

  public String render(Block block) {
    return switch (block.role()) {
      case BULLET_ITEM -> renderBullets(block.lines());
      case HEADING -> block.lines().get(0).strip();
      case PARAGRAPH_FRAGMENT -> renderParagraph(block.lines());
      case BLANK -> throw new IllegalArgumentException("Blank blocks cannot be rendered");
    };
  }

  /** Renders every block, dropping any whose output is blank. */
  public FormattedDocument assemble(List<Block> blocks) {
    List<RenderedBlock> rendered = new ArrayList<>(blocks.size());
    for (Block block : blocks) {
      String text = render(block).strip();
      if (!text.isEmpty()) {
        rendered.add(new RenderedBlock(block.role(), text));
      }
    }
    return new FormattedDocument(rendered);
  }

  private String renderParagraph(List<String> lines) {
    String joined =
        lines.stream()
            .map(line -> LineClassifier.normalizeSpaces(line).strip())
            .filter(s -> !s.isEmpty())
            .collect(Collectors.joining(" "));
    return MULTIPLE_SPACES.matcher(joined).replaceAll(" ");
  }

  private String renderBullets(List<String> lines) {
    return lines.stream().map(this::renderBullet).collect(Collectors.joining("\n"));
  }

  private String renderBullet(String line) {
    String trimmed = line.strip();
    if (patterns.markerPolicy() == BulletMarkerPolicy.PRESERVE) {
      return trimmed;
    }
    for (BulletPattern bullet : patterns.bulletPatterns()) {
      int markerLength = bullet.markerLength(trimmed);
      if (markerLength < 0) {
        continue;
      }
      if (bullet.glyph() || patterns.markerPolicy() == BulletMarkerPolicy.NORMALIZE_ALL) {
        return patterns.bulletMarker() + trimmed.substring(markerLength);
      }
      return trimmed;
    }
    return trimmed;
  }
}
