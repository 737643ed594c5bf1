package com.flamingo.ai.contextengine.api.rest;

import com.flamingo.ai.contextengine.service.cache.CacheStats;
import com.flamingo.ai.contextengine.service.cache.VectorCache;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and cache statistics. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final VectorCache vectorCache;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "chat-context-engine");
    return ResponseEntity.ok(health);
  }

  /** Returns vector cache counters and hit rate. */
  @GetMapping("/cache")
  public ResponseEntity<Map<String, Object>> cache() {
    CacheStats stats = vectorCache.stats();
    Map<String, Object> body = new HashMap<>();
    body.put("hits", stats.hits());
    body.put("misses", stats.misses());
    body.put("sets", stats.sets());
    body.put("errors", stats.errors());
    body.put("hitRate", stats.hitRate());
    body.put("compressionRatio", stats.compressionRatio());
    body.put("localSize", stats.localSize());
    return ResponseEntity.ok(body);
  }
}
