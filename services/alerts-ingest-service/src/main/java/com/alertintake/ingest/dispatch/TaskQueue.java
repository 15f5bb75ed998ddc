package com.alertintake.ingest.dispatch;

import java.util.List;
import java.util.Map;

/**
 * One-way boundary to the asynchronous task system.
 *
 * <p>Returning normally means the message was accepted for delivery, not that it was processed.
 * Delivery is at-least-once; consumers must tolerate duplicates.
 */
public interface TaskQueue {

  /**
   * @throws com.alertintake.ingest.common.web.EnqueueFailureException when the message could not
   *     be handed over
   */
  void enqueue(String taskName, List<Object> args, Map<String, Object> kwargs);
}
