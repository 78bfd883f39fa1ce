/*
 * どこで: Jobs モデル
 * 何を: キューに載せるジョブの封筒(メタデータ + payload)を定義する
 * なぜ: producer と worker で同じ JSON 形状を共有するため
 */
package com.dragonfly.jobs.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobEnvelope(
    String jobId,
    String traceId,
    String orgId,
    String idempotencyKey,
    String entityType,
    String entityId,
    int attempt,
    Instant createdAt,
    JsonNode payload) {

  public static final int IDEMPOTENCY_KEY_MAX_LENGTH = 512;

  /** 欠落または不正なフィールド名を返す。空なら処理可能。 */
  @JsonIgnore
  public List<String> invalidFields() {
    final List<String> invalid = new ArrayList<>();
    if (isBlank(orgId)) {
      invalid.add("org_id");
    }
    if (isBlank(idempotencyKey)) {
      invalid.add("idempotency_key");
    } else if (idempotencyKey.length() > IDEMPOTENCY_KEY_MAX_LENGTH) {
      invalid.add("idempotency_key(length>" + IDEMPOTENCY_KEY_MAX_LENGTH + ")");
    }
    if (isBlank(entityType)) {
      invalid.add("entity_type");
    }
    if (isBlank(entityId)) {
      invalid.add("entity_id");
    }
    return invalid;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
