/*
 * どこで: Jobs モデル
 * 何を: import_runs の 1 行を表す
 * なぜ: claim/finalize/reconcile/rollback の判定と運用表示に使うため
 */
package com.dragonfly.jobs.model;

import java.time.Instant;
import java.util.UUID;

public record ImportRunRecord(
    UUID runId,
    String sourceSystem,
    String sourceBatchId,
    String fileHash,
    String filename,
    String importKind,
    ImportRunStatus status,
    Integer rowsFetched,
    Integer rowsInserted,
    Integer rowsSkipped,
    Integer rowsErrored,
    String workerId,
    Instant claimedAt,
    Instant heartbeatAt,
    Instant completedAt,
    Instant reconciledAt,
    Instant rolledBackAt,
    String rollbackReason,
    String errorDetailsJson,
    Instant createdAt,
    Instant updatedAt) {}
