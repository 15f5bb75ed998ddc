package com.alertintake.ingest.ratelimit;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.common.web.RateLimitExceededException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

/**
 * Fixed-window request limits per channel and per organization, counted in Redis.
 *
 * <p>Fails open: if Redis cannot be reached the request is let through. The increment and the
 * window TTL are applied by one script, so a counter never outlives its window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntegrationRateLimitService {

  // a counter left without TTL (TTL < 0) gets one on its next hit
  static final RedisScript<Long> INCREMENT_IN_WINDOW =
      new DefaultRedisScript<>(
          "local count = redis.call('INCR', KEYS[1])\n"
              + "if redis.call('TTL', KEYS[1]) < 0 then\n"
              + "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n"
              + "end\n"
              + "return count",
          Long.class);

  private final StringRedisTemplate redis;

  @Value("${integrations.rate-limit.enabled:true}")
  private boolean enabled;

  @Value("${integrations.rate-limit.per-channel.window-seconds:60}")
  private long channelWindowSeconds;

  @Value("${integrations.rate-limit.per-channel.max-requests:300}")
  private long channelMaxRequests;

  @Value("${integrations.rate-limit.per-organization.window-seconds:60}")
  private long organizationWindowSeconds;

  @Value("${integrations.rate-limit.per-organization.max-requests:1000}")
  private long organizationMaxRequests;

  public void check(ChannelRef channel) {
    if (!enabled) {
      return;
    }

    long channelCount;
    long organizationCount;
    try {
      channelCount =
          incrementInWindow(
              "rl:integration:channel:" + channel.channelId(), channelWindowSeconds);
      organizationCount =
          incrementInWindow(
              "rl:integration:org:" + channel.organizationId(), organizationWindowSeconds);
    } catch (RuntimeException e) {
      log.warn("Rate limit check skipped, Redis unavailable: {}", e.getMessage());
      return;
    }

    if (channelCount > channelMaxRequests) {
      throw new RateLimitExceededException(
          "Rate-limit has been reached for this integration. Try again later.");
    }
    if (organizationCount > organizationMaxRequests) {
      throw new RateLimitExceededException(
          "Rate-limit has been reached for this organization. Try again later.");
    }
  }

  private long incrementInWindow(String key, long windowSeconds) {
    Long val =
        redis.execute(INCREMENT_IN_WINDOW, List.of(key), String.valueOf(windowSeconds));
    return val == null ? 0L : val;
  }
}
