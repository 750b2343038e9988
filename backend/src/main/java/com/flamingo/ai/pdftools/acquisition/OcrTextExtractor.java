package com.flamingo.ai.pdftools.acquisition;

import com.flamingo.ai.pdftools.config.PdfToolsProperties;
import com.flamingo.ai.pdftools.exception.OcrException;
import com.flamingo.ai.pdftools.exception.TextAcquisitionException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * OCR fallback stage: rasterizes a document and recognizes each page on the {@code ocrExecutor}
 * pool.
 *
 * <p>A page whose recognition fails becomes a {@link PageStatus#FAILED} outcome; the other pages
 * are unaffected. Results are returned in page order whatever order the pages complete in. The
 * whole stage runs under the {@code ocr} time limiter. When the stage fails (timeout, interrupt or
 * the pool rejecting a page) every page task already handed to the pool is cancelled: queued pages
 * never start and running pages are interrupted.
 */
@Component
@Slf4j
public class OcrTextExtractor {

  static final String TIME_LIMITER_NAME = "ocr";

  private final PageRasterizer rasterizer;
  private final OcrEngine ocrEngine;
  private final Executor ocrExecutor;
  private final TimeLimiter timeLimiter;
  private final PdfToolsProperties properties;
  private final MeterRegistry meterRegistry;

  public OcrTextExtractor(
      PageRasterizer rasterizer,
      OcrEngine ocrEngine,
      @Qualifier("ocrExecutor") Executor ocrExecutor,
      TimeLimiterRegistry timeLimiterRegistry,
      PdfToolsProperties properties,
      MeterRegistry meterRegistry) {
    this.rasterizer = rasterizer;
    this.ocrEngine = ocrEngine;
    this.ocrExecutor = ocrExecutor;
    this.timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER_NAME);
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  public List<PageOutcome> recognize(SourceDocument document) {
    PdfToolsProperties.Ocr ocr = properties.getOcr();
    List<PageImage> images = rasterizer.rasterize(document, ocr.getDpi(), ocr.getMaxPages());
    if (images.isEmpty()) {
      throw new TextAcquisitionException(
          "Rasterization produced no page images for " + document.fileName());
    }
    log.info("Running OCR on {} pages of {}", images.size(), document.fileName());

    List<PageTask> tasks = new ArrayList<>(images.size());
    try {
      for (PageImage image : images) {
        PageTask task = new PageTask(() -> recognizePage(image));
        tasks.add(task);
        ocrExecutor.execute(task);
      }
    } catch (RejectedExecutionException e) {
      cancel(tasks);
      throw new TextAcquisitionException(
          "OCR pool rejected work for " + document.fileName(), "OCR service is busy", e);
    }

    List<CompletableFuture<PageOutcome>> futures = tasks.stream().map(t -> t.result).toList();
    CompletableFuture<Void> all =
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    try {
      timeLimiter.executeFutureSupplier(() -> all);
    } catch (TimeoutException e) {
      cancel(tasks);
      throw new TextAcquisitionException(
          "OCR exceeded " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(),
          "Text recognition timed out",
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(tasks);
      throw new TextAcquisitionException("Interrupted while waiting for OCR", e);
    } catch (Exception e) {
      cancel(tasks);
      throw new TextAcquisitionException("OCR failed: " + e.getMessage(), e);
    }

    return futures.stream()
        .map(CompletableFuture::join)
        .sorted(Comparator.comparingInt(PageOutcome::pageIndex))
        .toList();
  }

  private PageOutcome recognizePage(PageImage page) {
    try {
      String text = ocrEngine.recognize(page.image());
      return PageOutcome.text(page.pageIndex(), text);
    } catch (OcrException | RuntimeException e) {
      log.warn("OCR failed for page {}: {}", page.pageIndex(), e.getMessage());
      meterRegistry.counter("ocr.page.failures").increment();
      return PageOutcome.failed(page.pageIndex(), e.getMessage());
    }
  }

  private static void cancel(List<PageTask> tasks) {
    tasks.forEach(task -> task.cancel(true));
  }

  /** Page recognition that can be interrupted, exposing its outcome as a future to wait on. */
  private static final class PageTask extends FutureTask<PageOutcome> {

    private final CompletableFuture<PageOutcome> result = new CompletableFuture<>();

    PageTask(Callable<PageOutcome> recognition) {
      super(recognition);
    }

    @Override
    protected void done() {
      try {
        result.complete(get());
      } catch (CancellationException e) {
        result.cancel(false);
      } catch (ExecutionException e) {
        result.completeExceptionally(e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        result.completeExceptionally(e);
      }
    }
  }
}
