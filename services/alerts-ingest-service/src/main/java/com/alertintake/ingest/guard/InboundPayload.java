package com.alertintake.ingest.guard;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A request body that passed {@link PayloadGuard}: within the size limit, of an accepted
 * encoding and parsed into a tree. Form bodies are represented as a JSON object.
 */
public record InboundPayload(JsonNode body, PayloadFormat format, int sizeBytes) {}
