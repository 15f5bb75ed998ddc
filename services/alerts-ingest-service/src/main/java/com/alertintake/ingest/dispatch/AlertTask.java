package com.alertintake.ingest.dispatch;

import com.alertintake.ingest.normalize.NormalizedAlert;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/** One unit of work for the task queue, produced by a normalizer. */
public record AlertTask(String taskName, List<Object> args, Map<String, Object> kwargs) {

  public static AlertTask createAlert(NormalizedAlert alert) {
    return new AlertTask(AlertTasks.CREATE_ALERT, List.of(), alert.toTaskKwargs());
  }

  public static AlertTask createAlertmanagerAlert(long channelPk, JsonNode alert) {
    return new AlertTask(
        AlertTasks.CREATE_ALERTMANAGER_ALERTS, List.of(channelPk, alert), Map.of());
  }
}
