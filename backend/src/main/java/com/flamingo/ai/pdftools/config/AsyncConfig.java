package com.flamingo.ai.pdftools.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools for page-level OCR. */
@Configuration
public class AsyncConfig {

  @Bean(name = "ocrExecutor")
  public Executor ocrExecutor(PdfToolsProperties properties) {
    PdfToolsProperties.Pool pool = properties.getOcr().getPool();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.getCorePoolSize());
    executor.setMaxPoolSize(pool.getMaxPoolSize());
    executor.setQueueCapacity(pool.getQueueCapacity());
    executor.setThreadNamePrefix("ocr-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
