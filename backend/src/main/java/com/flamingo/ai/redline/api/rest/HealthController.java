package com.flamingo.ai.redline.api.rest;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for liveness checks. */
@RestController
public class HealthController {

  /** Returns a simple health check response. {@code /v1/health} sits behind authentication. */
  @GetMapping({"/health", "/v1/health"})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "ok"));
  }
}
