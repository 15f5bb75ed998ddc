package com.alertintake.ingest.api;

import com.alertintake.ingest.cache.ChannelRoutingCache;
import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.common.web.UnknownChannelException;
import com.alertintake.ingest.common.web.WrongEndpointException;
import com.alertintake.ingest.dispatch.AlertDispatcher;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.dispatch.DispatchOutcome;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadGuard;
import com.alertintake.ingest.normalize.IntegrationNormalizer;
import com.alertintake.ingest.normalize.NormalizerRegistry;
import com.alertintake.ingest.ratelimit.IntegrationRateLimitService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one integration request: guard, resolve, endpoint check, rate limit, normalize, dispatch.
 * Every step either passes or throws an {@link
 * com.alertintake.ingest.common.web.IngestionException}; nothing is retried. The channel store is
 * never consulted here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionGateway {

  private final PayloadGuard guard;
  private final ChannelRoutingCache cache;
  private final NormalizerRegistry normalizers;
  private final IntegrationRateLimitService rateLimit;
  private final AlertDispatcher dispatcher;

  public DispatchOutcome ingest(
      IntegrationType endpointType, String token, HttpServletRequest request) {
    IntegrationNormalizer normalizer = normalizers.forType(endpointType);
    InboundPayload payload = guard.inspect(request, normalizer.acceptedFormats());

    ChannelRef channel = cache.resolve(token).orElseThrow(UnknownChannelException::new);
    if (channel.integrationType() != endpointType) {
      throw new WrongEndpointException(
          "This url is for integration with "
              + endpointType.slug()
              + ". Key is for "
              + channel.integrationType().slug());
    }

    rateLimit.check(channel);

    List<AlertTask> tasks = normalizer.normalize(channel, payload);
    DispatchOutcome outcome = dispatcher.dispatch(channel, tasks);
    log.debug(
        "Accepted {} payload for channel {} ({} bytes): enqueued={} failed={}",
        endpointType.slug(),
        channel.channelId(),
        payload.sizeBytes(),
        outcome.enqueued(),
        outcome.failed());
    return outcome;
  }

  /** Universal URLs carry the integration slug; only non-specialized integrations are valid. */
  public IntegrationType universalType(String slug) {
    return IntegrationType.fromSlug(slug)
        .filter(IntegrationType::isUniversal)
        .orElseThrow(
            () -> new WrongEndpointException("Unsupported integration type '" + slug + "'"));
  }
}
