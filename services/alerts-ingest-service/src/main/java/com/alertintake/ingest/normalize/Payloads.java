package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.common.web.MalformedPayloadException;
import com.alertintake.ingest.dispatch.AlertTask;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

final class Payloads {

  private Payloads() {}

  static JsonNode requireObject(JsonNode body, String integration) {
    if (body == null || !body.isObject()) {
      throw new MalformedPayloadException(integration + " payload must be a JSON object");
    }
    return body;
  }

  /** Scalar field as text; null for absent, JSON null, objects and arrays. */
  static String text(JsonNode body, String field) {
    JsonNode value = body.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    return value.asText();
  }

  /** One create_alertmanager_alerts task per entry of {@code alerts}, in array order. */
  static List<AlertTask> alertmanagerTasks(ChannelRef channel, JsonNode alerts) {
    if (!alerts.isArray()) {
      throw new MalformedPayloadException("'alerts' must be an array");
    }
    List<AlertTask> tasks = new ArrayList<>(alerts.size());
    for (int i = 0; i < alerts.size(); i++) {
      JsonNode alert = alerts.get(i);
      if (alert == null || !alert.isObject()) {
        throw new MalformedPayloadException("alerts[" + i + "] must be a JSON object");
      }
      tasks.add(AlertTask.createAlertmanagerAlert(channel.channelId(), alert));
    }
    return tasks;
  }
}
