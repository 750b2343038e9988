package com.flamingo.ai.pdftools.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ParagraphReflow")
class ParagraphReflowTest {

  private static final Block BULLETS =
      new Block(LineRole.BULLET_ITEM, List.of("- dash", "• glyph", "3. third", "(b) second"));

  @Test
  @DisplayName("should flow paragraph fragments into one line with single spaces")
  void shouldJoinFragments_whenParagraph() {
    ParagraphReflow reflow = new ParagraphReflow(LinePatterns.defaults());
    Block block =
        new Block(LineRole.PARAGRAPH_FRAGMENT, List.of("  first   part ", "", "second\tpart  "));

    assertThat(reflow.render(block)).isEqualTo("first part second\tpart");
  }

  @Test
  @DisplayName("should keep heading casing and trim it")
  void shouldKeepHeading_whenRendered() {
    ParagraphReflow reflow = new ParagraphReflow(LinePatterns.defaults());

    assertThat(reflow.render(new Block(LineRole.HEADING, List.of("  REPORT Title  "))))
        .isEqualTo("REPORT Title");
  }

  @Test
  @DisplayName("should normalize only glyph markers by default")
  void shouldNormalizeGlyphs_whenDefaultPolicy() {
    ParagraphReflow reflow = new ParagraphReflow(LinePatterns.defaults());

    assertThat(reflow.render(BULLETS)).isEqualTo("• dash\n• glyph\n3. third\n(b) second");
  }

  @Test
  @DisplayName("should normalize every marker when configured to")
  void shouldNormalizeAll_whenPolicyIsNormalizeAll() {
    ParagraphReflow reflow =
        new ParagraphReflow(
            LinePatterns.defaults().withMarkerPolicy(BulletMarkerPolicy.NORMALIZE_ALL));

    assertThat(reflow.render(BULLETS)).isEqualTo("• dash\n• glyph\n• third\n• second");
  }

  @Test
  @DisplayName("should leave markers as written when preserving")
  void shouldPreserveMarkers_whenPolicyIsPreserve() {
    ParagraphReflow reflow =
        new ParagraphReflow(LinePatterns.defaults().withMarkerPolicy(BulletMarkerPolicy.PRESERVE));

    assertThat(reflow.render(BULLETS)).isEqualTo("- dash\n• glyph\n3. third\n(b) second");
  }

  @Test
  @DisplayName("should reject blank blocks")
  void shouldThrow_whenBlockIsBlank() {
    assertThatThrownBy(() -> new Block(LineRole.BLANK, List.of("")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should assemble blocks separated by one blank line")
  void shouldAssemble_whenSeveralBlocks() {
    ParagraphReflow reflow = new ParagraphReflow(LinePatterns.defaults());

    FormattedDocument document =
        reflow.assemble(
            List.of(
                new Block(LineRole.HEADING, List.of("TITLE")),
                new Block(LineRole.PARAGRAPH_FRAGMENT, List.of("body"))));

    assertThat(document.text()).isEqualTo("TITLE\n\nbody");
    assertThat(document.blocks())
        .extracting(RenderedBlock::role)
        .containsExactly(LineRole.HEADING, LineRole.PARAGRAPH_FRAGMENT);
  }
}
