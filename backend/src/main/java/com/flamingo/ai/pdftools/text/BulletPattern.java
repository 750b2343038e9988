package com.flamingo.ai.pdftools.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A prefix pattern that marks a line as a list item.
 *
 * <p>The pattern is matched against the start of the trimmed line. {@code glyph} distinguishes
 * dash/bullet-glyph markers (candidates for normalization to a single bullet) from numbered or
 * lettered markers, which usually carry meaning and are kept as written.
 *
 * @param pattern compiled prefix pattern; anchoring is applied by {@link #markerLength}
 * @param glyph {@code true} for dash or bullet-glyph markers
 */
public record BulletPattern(Pattern pattern, boolean glyph) {

  /** Dash or bullet glyph followed by whitespace, e.g. {@code "- item"} or {@code "• item"}. */
  public static final BulletPattern DASH_OR_GLYPH = of("[-\\u2022]\\s+", true);

  /** Arabic number and period followed by whitespace, e.g. {@code "12. item"}. */
  public static final BulletPattern NUMBERED = of("\\d+\\.\\s+", false);

  /** Single letter or digit in parentheses followed by whitespace, e.g. {@code "(a) item"}. */
  public static final BulletPattern PARENTHESIZED = of("\\(\\w\\)\\s+", false);

  public static BulletPattern of(String regex, boolean glyph) {
    return new BulletPattern(Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS), glyph);
  }

  /**
   * Returns the length of the marker prefix of {@code trimmed}, or {@code -1} if the line does
   * not start with this marker.
   */
  public int markerLength(String trimmed) {
    Matcher matcher = pattern.matcher(trimmed);
    return matcher.lookingAt() ? matcher.end() : -1;
  }
}
