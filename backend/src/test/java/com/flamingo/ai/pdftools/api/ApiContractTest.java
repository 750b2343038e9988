package com.flamingo.ai.pdftools.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pdftools.api.rest.ConversionController;
import com.flamingo.ai.pdftools.api.rest.HealthController;
import com.flamingo.ai.pdftools.api.rest.PdfToolsController;
import com.flamingo.ai.pdftools.api.rest.TextExtractionController;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;

/**
 * Contract tests pinning the public endpoint paths.
 *
 * <p>Every tool is a multipart POST at the root of the service:
 *
 * <ul>
 *   <li>POST /extract-text, /pdf-to-word
 *   <li>POST /word-to-pdf, /ppt-to-pdf, /jpg-to-pdf, /pdf-to-jpg
 *   <li>POST /merge-pdf, /split-pdf, /rotate-pdf, /compress-pdf, /protect-pdf, /unlock-pdf
 *   <li>GET /, /health
 * </ul>
 */
class ApiContractTest {

  private static List<String> postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(m -> m.getAnnotation(PostMapping.class))
        .filter(Objects::nonNull)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toList();
  }

  private static List<PostMapping> postMappings(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(m -> m.getAnnotation(PostMapping.class))
        .filter(Objects::nonNull)
        .toList();
  }

  @Nested
  @DisplayName("TextExtractionController API contract")
  class TextExtractionContract {

    @Test
    @DisplayName("should expose text extraction and PDF to Word")
    void shouldExposeTextEndpoints() {
      assertThat(postPaths(TextExtractionController.class))
          .containsExactlyInAnyOrder("/extract-text", "/pdf-to-word");
    }
  }

  @Nested
  @DisplayName("ConversionController API contract")
  class ConversionContract {

    @Test
    @DisplayName("should expose the format conversions")
    void shouldExposeConversionEndpoints() {
      assertThat(postPaths(ConversionController.class))
          .containsExactlyInAnyOrder("/word-to-pdf", "/ppt-to-pdf", "/jpg-to-pdf", "/pdf-to-jpg");
    }
  }

  @Nested
  @DisplayName("PdfToolsController API contract")
  class PdfToolsContract {

    @Test
    @DisplayName("should expose the structural PDF tools")
    void shouldExposePdfEndpoints() {
      assertThat(postPaths(PdfToolsController.class))
          .containsExactlyInAnyOrder(
              "/merge-pdf",
              "/split-pdf",
              "/rotate-pdf",
              "/compress-pdf",
              "/protect-pdf",
              "/unlock-pdf");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthContract {

    @Test
    @DisplayName("should answer GET / and GET /health")
    void shouldExposeHealthEndpoints() {
      List<String> paths =
          Arrays.stream(HealthController.class.getDeclaredMethods())
              .map(m -> m.getAnnotation(GetMapping.class))
              .filter(Objects::nonNull)
              .flatMap(mapping -> Arrays.stream(mapping.value()))
              .toList();
      assertThat(paths).containsExactlyInAnyOrder("/", "/health");
    }
  }

  @Test
  @DisplayName("every tool endpoint should consume multipart form data")
  void toolEndpointsShouldConsumeMultipart() {
    for (Class<?> controller :
        List.of(
            TextExtractionController.class, ConversionController.class, PdfToolsController.class)) {
      assertThat(postMappings(controller))
          .allSatisfy(
              mapping ->
                  assertThat(mapping.consumes())
                      .containsExactly(MediaType.MULTIPART_FORM_DATA_VALUE));
    }
  }
}
