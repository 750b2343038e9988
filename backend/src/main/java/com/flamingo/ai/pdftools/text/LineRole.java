package com.flamingo.ai.pdftools.text;

/** Structural role of a single line of extracted text. */
public enum LineRole {
  /** Short upper-case or title-case line rendered on its own. */
  HEADING,

  /** List item introduced by a dash, bullet glyph, number or parenthesized letter. */
  BULLET_ITEM,

  /** Ordinary text that is flowed together with its neighbours. */
  PARAGRAPH_FRAGMENT,

  /** Empty or whitespace-only line; acts as a separator and is never rendered. */
  BLANK
}
