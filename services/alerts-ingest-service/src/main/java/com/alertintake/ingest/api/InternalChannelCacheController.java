package com.alertintake.ingest.api;

import com.alertintake.ingest.cache.CacheStats;
import com.alertintake.ingest.cache.ChannelRoutingCache;
import com.alertintake.ingest.cache.RefreshResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator API for the routing cache; guarded by InternalApiAuthFilter. */
@RestController
@RequestMapping("/internal/channel-cache")
public class InternalChannelCacheController {

  private final ChannelRoutingCache cache;

  public InternalChannelCacheController(ChannelRoutingCache cache) {
    this.cache = cache;
  }

  @GetMapping
  public CacheStats stats() {
    return cache.stats();
  }

  @PostMapping("/refresh")
  public ResponseEntity<RefreshResult> refresh() {
    RefreshResult result = cache.refresh();
    return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(result);
  }
}
