package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadFormat;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class MaintenanceNormalizer implements IntegrationNormalizer {

  @Override
  public Set<IntegrationType> supportedTypes() {
    return Set.of(IntegrationType.MAINTENANCE);
  }

  @Override
  public Set<PayloadFormat> acceptedFormats() {
    return Set.of(PayloadFormat.JSON);
  }

  @Override
  public List<AlertTask> normalize(ChannelRef channel, InboundPayload payload) {
    JsonNode body = Payloads.requireObject(payload.body(), "Maintenance");
    NormalizedAlert alert =
        new NormalizedAlert(
            Payloads.text(body, "title"),
            Payloads.text(body, "message"),
            null,
            null,
            channel.channelId(),
            null,
            body);
    return List.of(AlertTask.createAlert(alert));
  }
}
