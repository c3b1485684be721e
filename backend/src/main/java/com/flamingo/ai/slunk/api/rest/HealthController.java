package com.flamingo.ai.slunk.api.rest;

import com.flamingo.ai.slunk.api.dto.response.SystemStats;
import com.flamingo.ai.slunk.service.health.HealthService;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Returns a simple health check response. */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "slunk");
    return ResponseEntity.ok(health);
  }

  /** Returns system statistics. */
  @GetMapping("/api/stats")
  public ResponseEntity<SystemStats> stats() {
    return ResponseEntity.ok(healthService.getSystemStats());
  }
}
