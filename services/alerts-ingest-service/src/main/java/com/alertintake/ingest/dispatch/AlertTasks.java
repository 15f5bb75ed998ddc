package com.alertintake.ingest.dispatch;

/** Task names understood by the alert-creation workers. */
public final class AlertTasks {

  /** kwargs-only task carrying the fields of one normalized alert. */
  public static final String CREATE_ALERT = "create_alert";

  /** Positional task: (channel pk, one Alertmanager-shaped alert object). */
  public static final String CREATE_ALERTMANAGER_ALERTS = "create_alertmanager_alerts";

  private AlertTasks() {
    throw new UnsupportedOperationException("Utility class");
  }
}
