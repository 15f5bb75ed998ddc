package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadFormat;
import java.util.List;
import java.util.Set;

/**
 * Turns one accepted request body into the tasks to enqueue. Each integration type is served by
 * exactly one implementation, see {@link NormalizerRegistry}.
 */
public interface IntegrationNormalizer {

  Set<IntegrationType> supportedTypes();

  /** Body encodings handed to {@link com.alertintake.ingest.guard.PayloadGuard}. */
  Set<PayloadFormat> acceptedFormats();

  /**
   * @return tasks in the order they must be enqueued, possibly empty
   * @throws com.alertintake.ingest.common.web.MalformedPayloadException if the body does not have
   *     the expected structure; nothing is enqueued in that case
   */
  List<AlertTask> normalize(ChannelRef channel, InboundPayload payload);
}
