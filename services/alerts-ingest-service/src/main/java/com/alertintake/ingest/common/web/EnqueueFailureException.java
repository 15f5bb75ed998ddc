package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

/**
 * The task queue did not accept a task. Thrown by {@link
 * com.alertintake.ingest.dispatch.TaskQueue} implementations per task, and by the dispatcher for
 * a whole batch only when integrations.fail-on-total-enqueue-failure is on.
 */
public class EnqueueFailureException extends IngestionException {

  public EnqueueFailureException(String message, Throwable cause) {
    super(message, cause == null ? null : cause.getMessage(), cause);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.SERVICE_UNAVAILABLE;
  }

  @Override
  public String code() {
    return "ENQUEUE_FAILED";
  }
}
