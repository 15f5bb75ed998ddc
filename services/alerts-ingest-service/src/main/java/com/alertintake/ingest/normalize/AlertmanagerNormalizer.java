package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.common.web.MalformedPayloadException;
import com.alertintake.ingest.common.web.WrongEndpointException;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadFormat;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Alertmanager webhook contract, shared by Prometheus Alertmanager and Grafana Alerting: an object
 * with an {@code alerts} array, fanned out to one task per alert.
 */
@Component
public class AlertmanagerNormalizer implements IntegrationNormalizer {

  // top-level key Grafana Alerting adds and Prometheus Alertmanager never sends
  private static final String GRAFANA_ALERTING_MARKER = "orgId";

  @Override
  public Set<IntegrationType> supportedTypes() {
    return Set.of(IntegrationType.ALERTMANAGER, IntegrationType.GRAFANA_ALERTING);
  }

  @Override
  public Set<PayloadFormat> acceptedFormats() {
    return Set.of(PayloadFormat.JSON);
  }

  @Override
  public List<AlertTask> normalize(ChannelRef channel, InboundPayload payload) {
    JsonNode body = Payloads.requireObject(payload.body(), "Alertmanager");

    if (channel.integrationType() == IntegrationType.ALERTMANAGER
        && body.has(GRAFANA_ALERTING_MARKER)) {
      throw new WrongEndpointException(
          "Payload is in Grafana Alerting format. Use a grafana_alerting integration for it");
    }

    JsonNode alerts = body.get("alerts");
    if (alerts == null || alerts.isNull()) {
      throw new MalformedPayloadException("'alerts' is required");
    }
    return Payloads.alertmanagerTasks(channel, alerts);
  }
}
