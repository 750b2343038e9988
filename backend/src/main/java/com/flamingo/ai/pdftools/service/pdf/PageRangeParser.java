package com.flamingo.ai.pdftools.service.pdf;

import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses page specifications such as {@code "1,3,5-8"}.
 *
 * <p>Parts are comma separated. A range {@code a-b} with {@code a > b} is read as {@code b-a}.
 * Parts that are not a number or a range are ignored, as are pages outside {@code 1..total}.
 */
@Slf4j
public final class PageRangeParser {

  private static final Pattern COMMA = Pattern.compile(",");

  private PageRangeParser() {}

  public static PageSelection parse(String spec, int totalPages) {
    TreeSet<Integer> pages = new TreeSet<>();
    if (spec == null) {
      return new PageSelection(pages.stream().toList());
    }
    for (String rawPart : COMMA.split(spec)) {
      String part = rawPart.strip();
      if (part.isEmpty()) {
        continue;
      }
      int dash = part.indexOf('-');
      try {
        if (dash >= 0) {
          int from = Integer.parseInt(part.substring(0, dash).strip());
          int to = Integer.parseInt(part.substring(dash + 1).strip());
          addRange(pages, Math.min(from, to), Math.max(from, to), totalPages);
        } else {
          addRange(pages, Integer.parseInt(part), Integer.parseInt(part), totalPages);
        }
      } catch (NumberFormatException e) {
        log.debug("Ignoring malformed page range part '{}'", part);
      }
    }
    return new PageSelection(pages.stream().toList());
  }

  private static void addRange(TreeSet<Integer> pages, int from, int to, int totalPages) {
    for (int page = Math.max(from, 1); page <= Math.min(to, totalPages); page++) {
      pages.add(page);
    }
  }
}
