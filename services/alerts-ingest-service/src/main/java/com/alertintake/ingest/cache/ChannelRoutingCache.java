package com.alertintake.ingest.cache;

import com.alertintake.ingest.channel.Channel;
import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.ChannelStore;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Process-wide token to channel lookup used by every integration request.
 *
 * <p>{@link #resolve(String)} only reads the current in-memory snapshot, so ingestion keeps
 * working while the channel store is unreachable. {@link #refresh()} is the single writer: it
 * loads all channels in one pass and publishes a new immutable snapshot through a volatile
 * reference. Readers never lock and never see a half-built map.
 */
@Service
@Slf4j
public class ChannelRoutingCache {

  private final ChannelStore store;
  private final Clock clock;

  private volatile Snapshot snapshot = Snapshot.EMPTY;

  // guarded by "this"; only refresh() and teardown() touch them
  private Instant lastFailureAt;
  private String lastFailure;
  private int consecutiveFailures;

  @Autowired
  public ChannelRoutingCache(ChannelStore store) {
    this(store, Clock.systemUTC());
  }

  ChannelRoutingCache(ChannelStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  public Optional<ChannelRef> resolve(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(snapshot.byToken().get(token));
  }

  @EventListener(ApplicationReadyEvent.class)
  public void init() {
    RefreshResult result = refresh();
    if (result.success()) {
      log.info("Channel routing cache initialised with {} channels", result.entries());
    } else {
      log.warn(
          "Channel routing cache started empty, store unavailable: {}. Will retry on schedule",
          result.error());
    }
  }

  @Scheduled(
      initialDelayString = "${integrations.channel-cache.refresh-interval:PT1M}",
      fixedDelayString = "${integrations.channel-cache.refresh-interval:PT1M}")
  public void scheduledRefresh() {
    refresh();
  }

  public synchronized RefreshResult refresh() {
    Instant now = clock.instant();
    List<Channel> channels;
    try {
      channels = store.listAllChannels();
    } catch (RuntimeException e) {
      consecutiveFailures++;
      lastFailureAt = now;
      lastFailure = e.getMessage();
      log.warn(
          "Failed to refresh channel routing cache ({} in a row), keeping {} cached channels: {}",
          consecutiveFailures,
          snapshot.byToken().size(),
          e.getMessage());
      return RefreshResult.failed(snapshot.byToken().size(), now, e.getMessage());
    }

    Map<String, ChannelRef> next = new HashMap<>();
    if (channels != null) {
      for (Channel c : channels) {
        if (c == null || c.token() == null || c.token().isBlank()) {
          continue;
        }
        ChannelRef previous = next.put(c.token(), c.toRef());
        if (previous != null) {
          log.warn(
              "Duplicate channel token {} (ids {} and {}), keeping the latter",
              mask(c.token()),
              previous.channelId(),
              c.id());
        }
      }
    }
    snapshot = new Snapshot(Map.copyOf(next), now);
    consecutiveFailures = 0;
    log.debug("Channel routing cache refreshed: {} channels", next.size());
    return RefreshResult.ok(next.size(), now);
  }

  public synchronized CacheStats stats() {
    Snapshot current = snapshot;
    return new CacheStats(
        current.byToken().size(),
        current.refreshedAt(),
        lastFailureAt,
        lastFailure,
        consecutiveFailures);
  }

  @PreDestroy
  public synchronized void teardown() {
    snapshot = Snapshot.EMPTY;
    lastFailureAt = null;
    lastFailure = null;
    consecutiveFailures = 0;
  }

  /** Keeps the first four characters of a token for log lines. */
  public static String mask(String token) {
    if (token == null) {
      return "null";
    }
    return token.length() <= 4 ? "****" : token.substring(0, 4) + "****";
  }

  private record Snapshot(Map<String, ChannelRef> byToken, Instant refreshedAt) {
    static final Snapshot EMPTY = new Snapshot(Map.of(), null);
  }
}
