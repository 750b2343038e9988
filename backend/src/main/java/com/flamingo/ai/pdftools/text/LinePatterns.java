package com.flamingo.ai.pdftools.text;

import java.util.List;

/**
 * Heuristic tables shared by {@link LineClassifier} and {@link ParagraphReflow}.
 *
 * <p>Immutable; passed to the pipeline components at construction time.
 *
 * @param bulletPatterns prefix patterns that mark list items, checked in order
 * @param headingMinWords minimum number of words in a heading line (inclusive)
 * @param headingMaxWords maximum number of words in a heading line (inclusive)
 * @param bulletMarker marker written in front of normalized bullet lines
 * @param markerPolicy which bullet markers get normalized
 */
public record LinePatterns(
    List<BulletPattern> bulletPatterns,
    int headingMinWords,
    int headingMaxWords,
    String bulletMarker,
    BulletMarkerPolicy markerPolicy) {

  public static final String DEFAULT_BULLET_MARKER = "• ";

  public static final List<BulletPattern> DEFAULT_BULLET_PATTERNS =
      List.of(BulletPattern.DASH_OR_GLYPH, BulletPattern.NUMBERED, BulletPattern.PARENTHESIZED);

  public LinePatterns {
    if (headingMinWords < 1 || headingMaxWords < headingMinWords) {
      throw new IllegalArgumentException(
          "Invalid heading word bounds: " + headingMinWords + ".." + headingMaxWords);
    }
    bulletPatterns = List.copyOf(bulletPatterns);
    if (bulletMarker == null || bulletMarker.isBlank()) {
      bulletMarker = DEFAULT_BULLET_MARKER;
    }
    if (markerPolicy == null) {
      markerPolicy = BulletMarkerPolicy.NORMALIZE_GLYPHS;
    }
  }

  /** Dash/glyph, numbered and parenthesized bullets; headings of 1 to 8 words. */
  public static LinePatterns defaults() {
    return new LinePatterns(
        DEFAULT_BULLET_PATTERNS,
        1,
        8,
        DEFAULT_BULLET_MARKER,
        BulletMarkerPolicy.NORMALIZE_GLYPHS);
  }

  /** Returns a copy using a different bullet marker policy. */
  public LinePatterns withMarkerPolicy(BulletMarkerPolicy policy) {
    return new LinePatterns(bulletPatterns, headingMinWords, headingMaxWords, bulletMarker, policy);
  }
}
