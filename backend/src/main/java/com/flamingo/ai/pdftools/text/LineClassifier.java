package com.flamingo.ai.pdftools.text;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assigns a {@link LineRole} to each line of extracted text.
 *
 * <p>Rules, in precedence order:
 *
 * <ol>
 *   <li><strong>Blank</strong>: nothing left after trimming. No-break and other Unicode spaces
 *       count as whitespace.
 *   <li><strong>Bullet item</strong>: the trimmed line starts with one of the configured {@link
 *       BulletPattern}s.
 *   <li><strong>Heading</strong>: a short line (word count within the configured bounds) that is
 *       either fully upper-case with at least one letter, or in which every word starts with an
 *       upper-case letter.
 *   <li><strong>Paragraph fragment</strong>: anything else.
 * </ol>
 *
 * <p>Stateless and thread-safe once constructed.
 */
public class LineClassifier {

  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern SPACE_SEPARATORS = Pattern.compile("\\p{Zs}");

  private final LinePatterns patterns;

  public LineClassifier(LinePatterns patterns) {
    this.patterns = patterns;
  }

  /** Classifies a single line in isolation. */
  public LineRole classify(String line) {
    String trimmed = normalizeSpaces(line).strip();
    if (trimmed.isEmpty()) {
      return LineRole.BLANK;
    }
    if (isBullet(trimmed)) {
      return LineRole.BULLET_ITEM;
    }
    if (isHeading(trimmed)) {
      return LineRole.HEADING;
    }
    return LineRole.PARAGRAPH_FRAGMENT;
  }

  /**
   * Classifies every line of a document.
   *
   * <p>The heading index set is computed over the whole list first, so segmentation never sees a
   * partially classified document.
   */
  public List<ClassifiedLine> classifyAll(List<String> lines) {
    Set<Integer> headingIndexes = detectHeadings(lines);
    List<ClassifiedLine> classified = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      String line = normalizeSpaces(lines.get(i));
      String trimmed = line.strip();
      LineRole role;
      if (trimmed.isEmpty()) {
        role = LineRole.BLANK;
      } else if (isBullet(trimmed)) {
        role = LineRole.BULLET_ITEM;
      } else if (headingIndexes.contains(i)) {
        role = LineRole.HEADING;
      } else {
        role = LineRole.PARAGRAPH_FRAGMENT;
      }
      classified.add(new ClassifiedLine(line, role));
    }
    return classified;
  }

  /** Returns the zero-based indexes of every line that qualifies as a heading. */
  public Set<Integer> detectHeadings(List<String> lines) {
    Set<Integer> headings = new HashSet<>();
    for (int i = 0; i < lines.size(); i++) {
      String trimmed = normalizeSpaces(lines.get(i)).strip();
      if (!trimmed.isEmpty() && isHeading(trimmed)) {
        headings.add(i);
      }
    }
    return headings;
  }

  /**
   * Maps every Unicode space separator (no-break space, figure space, ideographic space and the
   * like) to an ASCII space so trimming and word splitting see them. {@code null} becomes empty.
   */
  static String normalizeSpaces(String line) {
    if (line == null) {
      return "";
    }
    return SPACE_SEPARATORS.matcher(line).replaceAll(" ");
  }

  /** Returns the first pattern matching the trimmed line, or {@code null}. */
  BulletPattern matchingBullet(String trimmed) {
    for (BulletPattern bullet : patterns.bulletPatterns()) {
      if (bullet.markerLength(trimmed) >= 0) {
        return bullet;
      }
    }
    return null;
  }

  private boolean isBullet(String trimmed) {
    return matchingBullet(trimmed) != null;
  }

  private boolean isHeading(String trimmed) {
    String[] words = WHITESPACE.split(trimmed);
    if (words.length < patterns.headingMinWords() || words.length > patterns.headingMaxWords()) {
      return false;
    }
    return isUpperCase(trimmed) || isTitleCase(words);
  }

  // Upper-case: no lower-case letter, at least one cased letter.
  private static boolean isUpperCase(String text) {
    boolean sawUpper = false;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      if (Character.isLowerCase(cp)) {
        return false;
      }
      if (Character.isUpperCase(cp) || Character.isTitleCase(cp)) {
        sawUpper = true;
      }
      i += Character.charCount(cp);
    }
    return sawUpper;
  }

  private static boolean isTitleCase(String[] words) {
    for (String word : words) {
      if (word.isEmpty()) {
        continue;
      }
      if (!Character.isUpperCase(word.codePointAt(0))) {
        return false;
      }
    }
    return true;
  }
}
