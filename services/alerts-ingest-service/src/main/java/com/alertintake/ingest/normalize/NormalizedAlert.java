package com.alertintake.ingest.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical alert record for the {@code create_alert} task. Fields a normalizer does not extract
 * stay {@code null} and are still written out, so every message has the same keys.
 */
public record NormalizedAlert(
    String title,
    String message,
    String imageUrl,
    String linkToUpstreamDetails,
    long alertReceiveChannelPk,
    String integrationUniqueData,
    JsonNode rawRequestData) {

  public NormalizedAlert {
    Objects.requireNonNull(rawRequestData, "rawRequestData");
  }

  /** Only the channel and the untouched payload; every other field absent. */
  public static NormalizedAlert raw(long channelPk, JsonNode rawRequestData) {
    return new NormalizedAlert(null, null, null, null, channelPk, null, rawRequestData);
  }

  public Map<String, Object> toTaskKwargs() {
    Map<String, Object> kwargs = new LinkedHashMap<>();
    kwargs.put("title", title);
    kwargs.put("message", message);
    kwargs.put("image_url", imageUrl);
    kwargs.put("link_to_upstream_details", linkToUpstreamDetails);
    kwargs.put("alert_receive_channel_pk", alertReceiveChannelPk);
    kwargs.put("integration_unique_data", integrationUniqueData);
    kwargs.put("raw_request_data", rawRequestData);
    return Collections.unmodifiableMap(kwargs);
  }
}
