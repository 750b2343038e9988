package com.flamingo.ai.pdftools.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the full reflow pipeline: classify, segment, render.
 *
 * <p>Unicode space separators are mapped to ASCII spaces. Input lines are then right-trimmed and
 * runs of blank lines collapsed to one before classification. The formatter is idempotent on its
 * own output.
 */
@Slf4j
@RequiredArgsConstructor
public class TextFormatter {

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");

  private final LineClassifier classifier;
  private final BlockSegmenter segmenter;
  private final ParagraphReflow reflow;

  public static TextFormatter withDefaults() {
    LinePatterns patterns = LinePatterns.defaults();
    return new TextFormatter(
        new LineClassifier(patterns), new BlockSegmenter(), new ParagraphReflow(patterns));
  }

  public FormattedDocument format(String raw) {
    if (raw == null || raw.isBlank()) {
      return new FormattedDocument(List.of());
    }
    return format(List.of(LINE_BREAK.split(raw, -1)));
  }

  public FormattedDocument format(List<String> lines) {
    List<String> normalized = normalize(lines);
    List<ClassifiedLine> classified = classifier.classifyAll(normalized);
    List<Block> blocks = segmenter.segment(classified);
    log.debug("Formatted {} lines into {} blocks", normalized.size(), blocks.size());
    return reflow.assemble(blocks);
  }

  private static List<String> normalize(List<String> lines) {
    List<String> normalized = new ArrayList<>(lines.size());
    boolean previousBlank = false;
    for (String line : lines) {
      String stripped = LineClassifier.normalizeSpaces(line).stripTrailing();
      boolean blank = stripped.isBlank();
      if (blank && previousBlank) {
        continue;
      }
      normalized.add(blank ? "" : stripped);
      previousBlank = blank;
    }
    return normalized;
  }
}
