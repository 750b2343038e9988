package com.flamingo.ai.pdftools.api.dto.response;

import com.flamingo.ai.pdftools.service.extraction.ExtractedText;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for text extraction. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractTextResponse {

  private String text;

  /** {@code text_layer} or {@code ocr}. */
  private String path;

  private Integer pageCount;

  /** Creates an ExtractTextResponse from an extraction result. */
  public static ExtractTextResponse from(ExtractedText extracted) {
    return ExtractTextResponse.builder()
        .text(extracted.text())
        .path(extracted.path().tag())
        .pageCount(extracted.pageCount())
        .build();
  }
}
