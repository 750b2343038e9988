package com.flamingo.ai.pdftools.config;

import com.flamingo.ai.pdftools.text.BlockSegmenter;
import com.flamingo.ai.pdftools.text.LineClassifier;
import com.flamingo.ai.pdftools.text.LinePatterns;
import com.flamingo.ai.pdftools.text.ParagraphReflow;
import com.flamingo.ai.pdftools.text.TextFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the line classification and reflow pipeline from {@link PdfToolsProperties}. */
@Configuration
@Slf4j
public class TextPipelineConfig {

  @Bean
  public LinePatterns linePatterns(PdfToolsProperties properties) {
    PdfToolsProperties.Formatting formatting = properties.getFormatting();
    LinePatterns patterns =
        new LinePatterns(
            LinePatterns.DEFAULT_BULLET_PATTERNS,
            formatting.getHeadingMinWords(),
            formatting.getHeadingMaxWords(),
            formatting.getBulletMarker(),
            formatting.getMarkerPolicy());
    log.info(
        "Text pipeline: headings {}-{} words, bullet policy {}",
        patterns.headingMinWords(),
        patterns.headingMaxWords(),
        patterns.markerPolicy());
    return patterns;
  }

  @Bean
  public LineClassifier lineClassifier(LinePatterns linePatterns) {
    return new LineClassifier(linePatterns);
  }

  @Bean
  public BlockSegmenter blockSegmenter() {
    return new BlockSegmenter();
  }

  @Bean
  public ParagraphReflow paragraphReflow(LinePatterns linePatterns) {
    return new ParagraphReflow(linePatterns);
  }

  @Bean
  public TextFormatter textFormatter(
      LineClassifier lineClassifier, BlockSegmenter blockSegmenter, ParagraphReflow reflow) {
    return new TextFormatter(lineClassifier, blockSegmenter, reflow);
  }
}
