/*
 * どこで: Jobs モデル
 * 何を: dead_letter_jobs の 1 行を表す
 * なぜ: 隔離したジョブを再投入できるよう元情報を保持するため
 */
package com.dragonfly.jobs.model;

import java.time.Instant;

public record DeadLetterEntry(
    long dlqId,
    String originalQueue,
    Long originalJobId,
    String idempotencyKey,
    String payloadJson,
    String errorMessage,
    int attemptCount,
    String workerId,
    Instant movedAt) {}
