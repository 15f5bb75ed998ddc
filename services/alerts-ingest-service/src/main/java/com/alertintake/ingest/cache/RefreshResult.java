package com.alertintake.ingest.cache;

import java.time.Instant;

/**
 * Outcome of {@link ChannelRoutingCache#refresh()}. A failed refresh is not an error for the
 * caller: the previous snapshot stays in service.
 */
public record RefreshResult(boolean success, int entries, Instant at, String error) {

  static RefreshResult ok(int entries, Instant at) {
    return new RefreshResult(true, entries, at, null);
  }

  static RefreshResult failed(int entriesKept, Instant at, String error) {
    return new RefreshResult(false, entriesKept, at, error);
  }
}
