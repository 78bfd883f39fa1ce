/*
 * どこで: Jobs サービス層
 * 何を: バッチ取込の claim/heartbeat/finalize/reconcile/rollback と行単位の重複排除を提供する
 * なぜ: 同じファイルの二重取込を防ぎ、落ちたワーカーの取込を安全に引き継げるようにするため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.config.ImportClaimProperties;
import com.dragonfly.jobs.model.ClaimResult;
import com.dragonfly.jobs.model.ImportRowResult;
import com.dragonfly.jobs.model.ImportRunRecord;
import com.dragonfly.jobs.model.ImportRunStatus;
import com.dragonfly.jobs.model.ReconcileResult;
import com.dragonfly.jobs.model.RollbackResult;
import com.dragonfly.jobs.repository.ImportRowRepository;
import com.dragonfly.jobs.repository.ImportRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class BatchClaimCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(BatchClaimCoordinator.class);
  private static final String FATAL_FLAG = "fatal";

  private final ImportRunRepository importRunRepository;
  private final ImportRowRepository importRowRepository;
  private final ImportClaimProperties properties;
  private final JobMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * (source_system, source_batch_id, file_hash) を claim する。
   *
   * <p>完了済みなら DUPLICATE、heartbeat が生きている先行 claim があれば IN_PROGRESS を返す。どちらの場合も副作用はない。
   */
  public ClaimResult claim(
      String sourceSystem,
      String sourceBatchId,
      String fileHash,
      String filename,
      String importKind,
      String workerId) {
    requireText(sourceSystem, "source_system");
    requireText(sourceBatchId, "source_batch_id");
    requireText(fileHash, "file_hash");
    requireText(workerId, "worker_id");
    for (int attempt = 1; attempt <= properties.claimMaxRetries(); attempt++) {
      final Instant now = Instant.now(clock);
      final Optional<ClaimResult> result =
          importRunRepository.claim(
              UUID.randomUUID(),
              sourceSystem,
              sourceBatchId,
              fileHash,
              filename,
              importKind,
              workerId,
              now,
              now.minus(properties.stalenessWindow()));
      if (result.isPresent()) {
        final ClaimResult claim = result.get();
        metrics.recordImportClaim(claim.status());
        logger.info(
            "import claim resolved runId={} status={} sourceSystem={} batchId={} workerId={}",
            claim.runId(),
            claim.status(),
            sourceSystem,
            sourceBatchId,
            workerId);
        return claim;
      }
      // 並行 INSERT の勝者がまだ見えていない。新しいスナップショットで取り直す
      logger.debug(
          "import claim raced with concurrent insert sourceSystem={} batchId={} attempt={}",
          sourceSystem,
          sourceBatchId,
          attempt);
    }
    throw new IllegalStateException(
        "import claim did not converge sourceSystem=" + sourceSystem + " batchId=" + sourceBatchId);
  }

  /** worker_id が一致する場合だけ延命する。奪われた claim には false を返す。 */
  public boolean heartbeat(UUID runId, String workerId) {
    final int updated = importRunRepository.heartbeat(runId, workerId, Instant.now(clock));
    if (updated == 0) {
      logger.warn("import heartbeat rejected runId={} workerId={}", runId, workerId);
    }
    return updated > 0;
  }

  /** 取込処理と同じ寿命で使う heartbeat タスクを開始する。 */
  public ImportHeartbeat startHeartbeat(UUID runId, String workerId) {
    final ImportHeartbeat heartbeat =
        new ImportHeartbeat(
            runId, workerId, properties.heartbeatInterval(), () -> heartbeat(runId, workerId));
    heartbeat.start();
    return heartbeat;
  }

  /**
   * 最終件数を保存する。markCompleted が false か errorDetails.fatal が true なら FAILED にする。
   *
   * @return workerId が claim を保持したままの run を更新できた場合 true
   */
  public boolean finalizeRun(
      UUID runId,
      String workerId,
      int rowsFetched,
      int rowsInserted,
      int rowsSkipped,
      int rowsErrored,
      JsonNode errorDetails,
      boolean markCompleted) {
    requireText(workerId, "worker_id");
    if (rowsFetched < 0 || rowsInserted < 0 || rowsSkipped < 0 || rowsErrored < 0) {
      throw new IllegalArgumentException("row counts must not be negative");
    }
    final boolean fatal = errorDetails != null && errorDetails.path(FATAL_FLAG).asBoolean(false);
    final ImportRunStatus status =
        markCompleted && !fatal ? ImportRunStatus.COMPLETED : ImportRunStatus.FAILED;
    final int updated =
        importRunRepository.finalizeRun(
            runId,
            workerId,
            status,
            rowsFetched,
            rowsInserted,
            rowsSkipped,
            rowsErrored,
            errorDetails == null || errorDetails.isNull() ? null : toJson(errorDetails),
            Instant.now(clock));
    if (updated == 0) {
      final ImportRunRecord run =
          importRunRepository.findById(runId).orElseThrow(() -> new ImportRunNotFoundException(runId));
      logger.warn(
          "import finalize skipped runId={} workerId={} currentStatus={} currentWorker={}",
          runId,
          workerId,
          run.status(),
          run.workerId());
      return false;
    }
    logger.info(
        "import finalized runId={} status={} fetched={} inserted={} skipped={} errored={}",
        runId,
        status,
        rowsFetched,
        rowsInserted,
        rowsSkipped,
        rowsErrored);
    return true;
  }

  /**
   * staging 行の実数と期待件数を突合する。不一致なら run を FAILED にする。
   *
   * @param expectedCount null の場合は rows_fetched を使う
   */
  @Transactional
  public ReconcileResult reconcile(UUID runId, Integer expectedCount) {
    final ImportRunRecord run =
        importRunRepository
            .findByIdForUpdate(runId)
            .orElseThrow(() -> new ImportRunNotFoundException(runId));
    if (run.status() == ImportRunStatus.ROLLED_BACK) {
      throw new ImportRunStateException("rolled back import run cannot be reconciled: " + runId);
    }
    if (run.status().isActive()) {
      throw new ImportRunStateException(
          "import run must be finalized before reconcile: " + runId + " status=" + run.status());
    }
    final Instant now = Instant.now(clock);
    final int actual = importRowRepository.countActiveByRun(runId);
    final int expected = resolveExpectedCount(expectedCount, run, actual);
    final int delta = expected - actual;
    final ReconcileResult result = new ReconcileResult(delta == 0, expected, actual, delta);
    if (result.valid()) {
      importRunRepository.markReconciled(runId, now);
      logger.info("import reconciled runId={} count={}", runId, actual);
      return result;
    }
    final ObjectNode details = objectMapper.createObjectNode();
    details.put("reconciliation_failed", true);
    details.put("expected_count", expected);
    details.put("actual_count", actual);
    details.put("delta", delta);
    details.put("reconciled_at", now.toString());
    importRunRepository.markReconciliationFailed(runId, toJson(details), now);
    logger.error(
        "import reconciliation mismatch runId={} expected={} actual={} delta={}",
        runId,
        expected,
        actual,
        delta);
    return result;
  }

  /** run と配下の行を ROLLED_BACK にする。物理削除はしない。既に ROLLED_BACK なら 0 行で成功する。 */
  @Transactional
  public RollbackResult rollback(UUID runId, String reason) {
    requireText(reason, "reason");
    final Optional<ImportRunRecord> run = importRunRepository.findByIdForUpdate(runId);
    if (run.isEmpty()) {
      logger.warn("import rollback requested for unknown run runId={}", runId);
      return new RollbackResult(false, 0);
    }
    if (run.get().status() == ImportRunStatus.ROLLED_BACK) {
      return new RollbackResult(true, 0);
    }
    final Instant now = Instant.now(clock);
    final int rows = importRowRepository.markRolledBackByRun(runId, now);
    importRunRepository.markRolledBack(runId, reason, now);
    logger.warn(
        "import rolled back runId={} previousStatus={} rows={} reason={}",
        runId,
        run.get().status(),
        rows,
        reason);
    return new RollbackResult(true, rows);
  }

  /**
   * 行を insert-or-ignore で追加する。同じ dedupe_key が既にあれば inserted=false。
   *
   * <p>run の行ロックを取るので、挿入中に別ワーカーが claim を奪うことはできない。
   */
  @Transactional
  public ImportRowResult insertRow(
      UUID runId, String workerId, JsonNode payload, String... naturalKeyParts) {
    requireText(workerId, "worker_id");
    final ImportRunRecord run =
        importRunRepository
            .findByIdForUpdate(runId)
            .orElseThrow(() -> new ImportRunNotFoundException(runId));
    if (!run.status().isActive()) {
      throw new ImportRunStateException(
          "rows can only be added to a claimed import run: " + runId + " status=" + run.status());
    }
    if (!workerId.equals(run.workerId())) {
      throw new ImportRunStateException(
          "import run is claimed by another worker: " + runId + " workerId=" + workerId);
    }
    final String dedupeKey = DedupeKeys.derive(run.sourceSystem(), naturalKeyParts);
    final boolean inserted =
        importRowRepository.insertIfAbsent(
            runId,
            run.sourceSystem(),
            dedupeKey,
            payload == null ? "{}" : toJson(payload),
            Instant.now(clock));
    return new ImportRowResult(inserted, dedupeKey);
  }

  public Optional<ImportRunRecord> find(UUID runId) {
    return importRunRepository.findById(runId);
  }

  public List<ImportRunRecord> recentRuns(int limit) {
    return importRunRepository.findRecent(limit);
  }

  /** heartbeat が staleness window を超えて途絶えている claim。次の claim() で奪い直せる。 */
  public List<ImportRunRecord> staleRuns(int limit) {
    return importRunRepository.findStale(
        Instant.now(clock).minus(properties.stalenessWindow()), limit);
  }

  private int resolveExpectedCount(Integer expectedCount, ImportRunRecord run, int actual) {
    if (expectedCount != null) {
      if (expectedCount < 0) {
        throw new IllegalArgumentException("expected_count must not be negative");
      }
      return expectedCount;
    }
    return run.rowsFetched() != null ? run.rowsFetched() : actual;
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private String toJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize import details", ex);
    }
  }
}
