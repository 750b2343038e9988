package com.flamingo.ai.pdftools.config;

import com.flamingo.ai.pdftools.text.BulletMarkerPolicy;
import com.flamingo.ai.pdftools.text.LinePatterns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the conversion service. */
@Configuration
@ConfigurationProperties(prefix = "pdftools")
@Validated
@Getter
@Setter
public class PdfToolsProperties {

  @Valid private Upload upload = new Upload();
  @Valid private Formatting formatting = new Formatting();
  @Valid private Ocr ocr = new Ocr();
  @Valid private Raster raster = new Raster();
  @Valid private Office office = new Office();
  @Valid private Compression compression = new Compression();

  @Getter
  @Setter
  public static class Upload {
    @NotNull private DataSize defaultLimit = DataSize.ofMegabytes(25);

    /** Compression accepts larger inputs than the other tools. */
    @NotNull private DataSize compressLimit = DataSize.ofMegabytes(50);
  }

  @Getter
  @Setter
  public static class Formatting {
    @Min(1)
    private int headingMinWords = 1;
    @Min(1)
    private int headingMaxWords = 8;
    private String bulletMarker = LinePatterns.DEFAULT_BULLET_MARKER;
    private BulletMarkerPolicy markerPolicy = BulletMarkerPolicy.NORMALIZE_GLYPHS;
  }

  @Getter
  @Setter
  public static class Ocr {
    private float dpi = 150f;

    /** Pages beyond this cap are not rasterized. */
    @Min(1)
    private int maxPages = 30;

    @NotBlank private String language = "eng";
    private int engineMode = 1;
    private int pageSegMode = 3;

    /** Tessdata directory; falls back to TESSDATA_PREFIX when unset. */
    private String datapath;

    @Valid private Pool pool = new Pool();
  }

  @Getter
  @Setter
  public static class Pool {
    @Min(1)
    private int corePoolSize = 2;
    @Min(1)
    private int maxPoolSize = 4;
    private int queueCapacity = 64;
  }

  @Getter
  @Setter
  public static class Raster {
    private float pdfToJpgDpi = 140f;
  }

  @Getter
  @Setter
  public static class Office {
    @NotBlank private String command = "libreoffice";
    private Duration timeout = Duration.ofSeconds(120);
  }

  @Getter
  @Setter
  public static class Compression {
    @NotBlank private String command = "gs";
    private String pdfSettings = "/ebook";
    private String compatibilityLevel = "1.4";
    private Duration timeout = Duration.ofSeconds(120);
  }
}
