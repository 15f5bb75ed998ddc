package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.common.web.MalformedPayloadException;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadFormat;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Every integration without a dedicated endpoint. The payload is opaque here: it is passed through
 * as {@code raw_request_data} of exactly one alert and templating happens downstream.
 */
@Component
public class UniversalNormalizer implements IntegrationNormalizer {

  @Override
  public Set<IntegrationType> supportedTypes() {
    return EnumSet.copyOf(IntegrationType.universalTypes());
  }

  @Override
  public Set<PayloadFormat> acceptedFormats() {
    return Set.of(PayloadFormat.JSON, PayloadFormat.FORM);
  }

  @Override
  public List<AlertTask> normalize(ChannelRef channel, InboundPayload payload) {
    JsonNode body = payload.body();
    if (body == null || !(body.isObject() || body.isArray())) {
      throw new MalformedPayloadException("Payload must be a JSON object or array");
    }
    return List.of(AlertTask.createAlert(NormalizedAlert.raw(channel.channelId(), body)));
  }
}
