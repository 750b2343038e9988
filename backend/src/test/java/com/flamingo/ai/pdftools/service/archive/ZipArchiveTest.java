package com.flamingo.ai.pdftools.service.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pdftools.testutil.Zips;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ZipArchive")
class ZipArchiveTest {

  @Test
  @DisplayName("should keep entries in insertion order")
  void shouldKeepInsertionOrder() {
    ZipArchive archive =
        new ZipArchive().add("page_10.pdf", new byte[] {1}).add("page_2.pdf", new byte[] {2});

    Map<String, byte[]> entries = Zips.entries(archive.toByteArray());

    assertThat(entries.keySet()).containsExactly("page_10.pdf", "page_2.pdf");
    assertThat(entries.get("page_2.pdf")).containsExactly(2);
  }

  @Test
  @DisplayName("should reject duplicate entry names")
  void shouldRejectDuplicates() {
    ZipArchive archive = new ZipArchive().add("a.jpg", new byte[0]);

    assertThatThrownBy(() -> archive.add("a.jpg", new byte[0]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
