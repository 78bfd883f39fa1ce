/*
 * どこで: Jobs モデル
 * 何を: processed_jobs の 1 行を表す
 * なぜ: 冪等キーごとの実行状態を判定に使うため
 */
package com.dragonfly.jobs.model;

import java.time.Instant;

public record ProcessedJobRecord(
    String idempotencyKey,
    String queueName,
    Long msgId,
    String workerId,
    ProcessedJobStatus status,
    int attempts,
    String resultJson,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public boolean ownedBy(long otherMsgId) {
    return msgId != null && msgId == otherMsgId;
  }
}
