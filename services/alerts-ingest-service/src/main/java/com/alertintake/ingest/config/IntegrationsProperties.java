package com.alertintake.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Settings of the public integration endpoints.
 *
 * @param maxPayloadSize upper bound of a request body, checked before the body is parsed
 * @param debug echo internal error detail (parser messages, causes) in 4xx bodies
 * @param failOnTotalEnqueueFailure answer 503 when every task of a non-empty batch failed to
 *     enqueue; otherwise such a batch is only logged
 */
@ConfigurationProperties(prefix = "integrations")
public record IntegrationsProperties(
    DataSize maxPayloadSize, boolean debug, boolean failOnTotalEnqueueFailure) {

  public static final DataSize DEFAULT_MAX_PAYLOAD_SIZE = DataSize.ofBytes(2_621_440);

  public IntegrationsProperties {
    if (maxPayloadSize == null || maxPayloadSize.toBytes() <= 0) {
      maxPayloadSize = DEFAULT_MAX_PAYLOAD_SIZE;
    }
  }
}
