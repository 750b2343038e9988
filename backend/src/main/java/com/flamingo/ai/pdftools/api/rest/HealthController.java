package com.flamingo.ai.pdftools.api.rest;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the service banner and health check. */
@RestController
public class HealthController {

  static final String BANNER = "PDF Tools Backend Running";

  /** Returns the service banner. */
  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> banner() {
    return ResponseEntity.ok(BANNER);
  }

  /** Returns a simple health check response. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "pdf-tools");
    return ResponseEntity.ok(health);
  }
}
