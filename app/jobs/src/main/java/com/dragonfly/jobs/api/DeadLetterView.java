package com.dragonfly.jobs.api;

import com.dragonfly.jobs.model.DeadLetterEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeadLetterView(
    long dlqId,
    String originalQueue,
    Long originalJobId,
    String idempotencyKey,
    JsonNode originalPayload,
    String errorMessage,
    int attemptCount,
    String workerId,
    Instant movedAt) {

  static DeadLetterView from(DeadLetterEntry entry, ObjectMapper objectMapper) {
    final JsonNode payload;
    try {
      payload = objectMapper.readTree(entry.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored dead letter payload is not valid JSON", ex);
    }
    return new DeadLetterView(
        entry.dlqId(),
        entry.originalQueue(),
        entry.originalJobId(),
        entry.idempotencyKey(),
        payload,
        entry.errorMessage(),
        entry.attemptCount(),
        entry.workerId(),
        entry.movedAt());
  }
}
