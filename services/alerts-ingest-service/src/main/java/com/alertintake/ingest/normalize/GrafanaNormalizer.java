package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.common.web.MalformedPayloadException;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Grafana notifications.
 *
 * <p>With an {@code alerts} key the body is Alertmanager-shaped and fans out per alert; an empty
 * array is accepted and yields no tasks. Without it the body is a legacy single-alert
 * notification ({@code title}, {@code message}, {@code imageUrl}, {@code ruleUrl},
 * {@code evalMatches}).
 */
@Component
@RequiredArgsConstructor
public class GrafanaNormalizer implements IntegrationNormalizer {

  private final ObjectMapper objectMapper;

  @Override
  public Set<IntegrationType> supportedTypes() {
    return Set.of(IntegrationType.GRAFANA);
  }

  @Override
  public Set<PayloadFormat> acceptedFormats() {
    return Set.of(PayloadFormat.JSON);
  }

  @Override
  public List<AlertTask> normalize(ChannelRef channel, InboundPayload payload) {
    JsonNode body = Payloads.requireObject(payload.body(), "Grafana");

    JsonNode alerts = body.get("alerts");
    if (alerts != null && !alerts.isNull()) {
      return Payloads.alertmanagerTasks(channel, alerts);
    }

    NormalizedAlert alert =
        new NormalizedAlert(
            Payloads.text(body, "title"),
            Payloads.text(body, "message"),
            Payloads.text(body, "imageUrl"),
            Payloads.text(body, "ruleUrl"),
            channel.channelId(),
            evalMatches(body),
            body);
    return List.of(AlertTask.createAlert(alert));
  }

  private String evalMatches(JsonNode body) {
    JsonNode matches = body.get("evalMatches");
    ObjectNode unique = objectMapper.createObjectNode();
    if (matches == null || matches.isNull()) {
      unique.putArray("evalMatches");
    } else if (matches.isArray()) {
      unique.set("evalMatches", matches);
    } else {
      throw new MalformedPayloadException("'evalMatches' must be an array");
    }
    try {
      return objectMapper.writeValueAsString(unique);
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException("'evalMatches' cannot be serialized", e.getMessage(), e);
    }
  }
}
