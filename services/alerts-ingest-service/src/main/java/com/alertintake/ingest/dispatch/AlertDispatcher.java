package com.alertintake.ingest.dispatch;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.common.web.EnqueueFailureException;
import com.alertintake.ingest.config.IntegrationsProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hands normalized tasks to the {@link TaskQueue} in input order.
 *
 * <p>A task that fails to enqueue is logged and dropped; tasks already enqueued for the same
 * request stay enqueued. There is no rollback and no retry here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertDispatcher {

  private final TaskQueue taskQueue;
  private final IntegrationsProperties properties;

  public DispatchOutcome dispatch(ChannelRef channel, List<AlertTask> tasks) {
    int enqueued = 0;
    int failed = 0;
    RuntimeException lastError = null;

    for (int i = 0; i < tasks.size(); i++) {
      AlertTask task = tasks.get(i);
      try {
        taskQueue.enqueue(task.taskName(), task.args(), task.kwargs());
        enqueued++;
      } catch (RuntimeException e) {
        failed++;
        lastError = e;
        log.error(
            "Dropped task {} #{} of {} for channel {}: {}",
            task.taskName(),
            i,
            tasks.size(),
            channel.channelId(),
            e.getMessage());
      }
    }

    DispatchOutcome outcome = new DispatchOutcome(enqueued, failed);
    if (outcome.allFailed() && properties.failOnTotalEnqueueFailure()) {
      throw new EnqueueFailureException(
          "None of " + failed + " tasks could be enqueued", lastError);
    }
    return outcome;
  }
}
