package com.alertintake.ingest.dispatch;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Wire envelope pushed to the queue; {@code id} lets consumers drop redeliveries. */
public record TaskMessage(
    UUID id, String task, List<Object> args, Map<String, Object> kwargs, Instant enqueuedAt) {}
