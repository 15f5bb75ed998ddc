package com.alertintake.ingest.dispatch;

import com.alertintake.ingest.common.web.EnqueueFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes task messages as JSON onto a Redis list. Producers LPUSH, workers BRPOP, which gives FIFO
 * order per list.
 */
@Component
@Slf4j
public class RedisTaskQueue implements TaskQueue {

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final String queueKey;

  public RedisTaskQueue(
      StringRedisTemplate redis,
      ObjectMapper objectMapper,
      @Value("${integrations.task-queue.key:alert-intake:tasks}") String queueKey) {
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.queueKey = queueKey;
  }

  @Override
  public void enqueue(String taskName, List<Object> args, Map<String, Object> kwargs) {
    TaskMessage message =
        new TaskMessage(
            UUID.randomUUID(),
            taskName,
            args == null ? List.of() : args,
            kwargs == null ? Map.of() : kwargs,
            Instant.now());

    String json;
    try {
      json = objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException e) {
      throw new EnqueueFailureException("Failed to serialize task " + taskName, e);
    }

    try {
      redis.opsForList().leftPush(queueKey, json);
    } catch (RuntimeException e) {
      throw new EnqueueFailureException("Task queue rejected task " + taskName, e);
    }
    log.debug("Enqueued task {} id={} on {}", taskName, message.id(), queueKey);
  }
}
