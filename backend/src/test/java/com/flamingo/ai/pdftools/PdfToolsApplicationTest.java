package com.flamingo.ai.pdftools;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pdftools.acquisition.OcrTextExtractor;
import com.flamingo.ai.pdftools.acquisition.TextAcquisitionService;
import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.service.extraction.TextExtractionService;
import com.flamingo.ai.pdftools.service.image.ImageConversionService;
import com.flamingo.ai.pdftools.service.office.OfficeConversionService;
import com.flamingo.ai.pdftools.service.pdf.PdfCompressionService;
import com.flamingo.ai.pdftools.service.pdf.PdfOperationsService;
import com.flamingo.ai.pdftools.service.word.PdfToWordService;
import com.flamingo.ai.pdftools.text.BulletMarkerPolicy;
import com.flamingo.ai.pdftools.text.LinePatterns;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.util.unit.DataSize;

/**
 * Verifies the Spring application context loads with the default configuration. No external tool
 * is started during context load, so the test runs without LibreOffice, Ghostscript or Tesseract.
 */
@SpringBootTest
class PdfToolsApplicationTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(TextAcquisitionService.class)).isNotNull();
    assertThat(applicationContext.getBean(OcrTextExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(TextExtractionService.class)).isNotNull();
    assertThat(applicationContext.getBean(PdfToWordService.class)).isNotNull();
    assertThat(applicationContext.getBean(PdfOperationsService.class)).isNotNull();
    assertThat(applicationContext.getBean(PdfCompressionService.class)).isNotNull();
    assertThat(applicationContext.getBean(OfficeConversionService.class)).isNotNull();
    assertThat(applicationContext.getBean(ImageConversionService.class)).isNotNull();
  }

  @Test
  @DisplayName("Configuration should bind from application.yml")
  void configurationShouldBind() {
    PdfToolsProperties properties = applicationContext.getBean(PdfToolsProperties.class);
    assertThat(properties.getUpload().getDefaultLimit()).isEqualTo(DataSize.ofMegabytes(25));
    assertThat(properties.getUpload().getCompressLimit()).isEqualTo(DataSize.ofMegabytes(50));
    assertThat(properties.getOcr().getMaxPages()).isEqualTo(30);

    LinePatterns patterns = applicationContext.getBean(LinePatterns.class);
    assertThat(patterns.headingMaxWords()).isEqualTo(8);
    assertThat(patterns.markerPolicy()).isEqualTo(BulletMarkerPolicy.NORMALIZE_GLYPHS);
  }

  @Test
  @DisplayName("OCR time limiter should use the configured budget")
  void ocrTimeLimiterShouldBeConfigured() {
    TimeLimiterRegistry registry = applicationContext.getBean(TimeLimiterRegistry.class);
    assertThat(registry.timeLimiter("ocr").getTimeLimiterConfig().getTimeoutDuration())
        .isEqualTo(Duration.ofSeconds(120));
  }
}
