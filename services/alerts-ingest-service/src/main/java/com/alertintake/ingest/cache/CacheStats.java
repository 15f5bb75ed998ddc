package com.alertintake.ingest.cache;

import java.time.Instant;

public record CacheStats(
    int entries,
    Instant lastRefreshedAt,
    Instant lastFailureAt,
    String lastFailure,
    int consecutiveFailures) {}
