package com.flamingo.ai.pdftools.service.word;

import com.flamingo.ai.pdftools.text.FormattedDocument;
import com.flamingo.ai.pdftools.text.RenderedBlock;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

/**
 * Writes a {@link FormattedDocument} as a .docx.
 *
 * <p>Headings become bold paragraphs, each bullet line an indented paragraph keeping its marker,
 * and paragraph blocks plain paragraphs.
 */
@Component
public class WordDocumentBuilder {

  /** Left indent of list items, in twentieths of a point. */
  static final int BULLET_INDENT_TWIPS = 360;

  static final int BULLET_HANGING_TWIPS = 240;

  public byte[] build(FormattedDocument document) throws IOException {
    try (XWPFDocument docx = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (RenderedBlock block : document.blocks()) {
        switch (block.role()) {
          case HEADING -> addHeading(docx, block.text());
          case BULLET_ITEM -> block.text().lines().forEach(line -> addBullet(docx, line));
          default -> addParagraph(docx, block.text());
        }
      }
      docx.write(out);
      return out.toByteArray();
    }
  }

  private static void addHeading(XWPFDocument docx, String text) {
    XWPFRun run = docx.createParagraph().createRun();
    run.setBold(true);
    run.setText(text);
  }

  private static void addBullet(XWPFDocument docx, String line) {
    XWPFParagraph paragraph = docx.createParagraph();
    paragraph.setIndentationLeft(BULLET_INDENT_TWIPS);
    paragraph.setIndentationHanging(BULLET_HANGING_TWIPS);
    paragraph.createRun().setText(line.strip());
  }

  private static void addParagraph(XWPFDocument docx, String text) {
    docx.createParagraph().createRun().setText(text);
  }
}
