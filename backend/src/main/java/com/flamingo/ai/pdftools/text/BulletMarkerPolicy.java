package com.flamingo.ai.pdftools.text;

/** How {@link ParagraphReflow} rewrites the marker of each bullet line. */
public enum BulletMarkerPolicy {
  /** Dash and glyph markers become the normalized bullet; numbered markers are kept. */
  NORMALIZE_GLYPHS,

  /** Every recognized marker is replaced by the normalized bullet. */
  NORMALIZE_ALL,

  /** Bullet lines are emitted exactly as written, only trimmed. */
  PRESERVE
}
