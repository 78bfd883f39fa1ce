/*
 * どこで: Jobs API
 * 何を: バッチ取込の claim/heartbeat/finalize/reconcile/rollback/行追加のエンドポイントを提供する
 * なぜ: JVM 外の取込ジョブからも同じ claim 契約を使えるようにするため
 */
package com.dragonfly.jobs.api;

import com.dragonfly.jobs.model.ClaimResult;
import com.dragonfly.jobs.model.ClaimStatus;
import com.dragonfly.jobs.model.ImportRowResult;
import com.dragonfly.jobs.model.ReconcileResult;
import com.dragonfly.jobs.model.RollbackResult;
import com.dragonfly.jobs.service.BatchClaimCoordinator;
import com.dragonfly.jobs.service.ImportRunNotFoundException;
import com.dragonfly.jobs.service.ImportRunStateException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/import-runs")
@RequiredArgsConstructor
@Validated
public class ImportRunController {

  private final BatchClaimCoordinator coordinator;
  private final ObjectMapper objectMapper;

  @PostMapping("/claim")
  public ResponseEntity<ClaimResult> claim(@Valid @RequestBody ClaimImportRequest request) {
    final ClaimResult result =
        coordinator.claim(
            request.sourceSystem(),
            request.sourceBatchId(),
            request.fileHash(),
            request.filename(),
            request.importKind(),
            request.workerId());
    if (result.status() == ClaimStatus.IN_PROGRESS) {
      // 別ワーカーが生きた claim を保持している。run_id は返すが処理はさせない
      return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }
    return ResponseEntity.ok(result);
  }

  @GetMapping("/{run_id}")
  public ImportRunView get(@PathVariable("run_id") UUID runId) {
    return coordinator
        .find(runId)
        .map(run -> ImportRunView.from(run, objectMapper))
        .orElseThrow(() -> new ImportRunNotFoundException(runId));
  }

  @PostMapping("/{run_id}/heartbeat")
  public ResponseEntity<HeartbeatResponse> heartbeat(
      @PathVariable("run_id") UUID runId, @Valid @RequestBody HeartbeatRequest request) {
    final boolean alive = coordinator.heartbeat(runId, request.workerId());
    if (alive) {
      return ResponseEntity.ok(new HeartbeatResponse(runId, true));
    }
    if (coordinator.find(runId).isEmpty()) {
      throw new ImportRunNotFoundException(runId);
    }
    return ResponseEntity.status(HttpStatus.CONFLICT).body(new HeartbeatResponse(runId, false));
  }

  @PostMapping("/{run_id}/finalize")
  public ImportRunView finalizeRun(
      @PathVariable("run_id") UUID runId, @Valid @RequestBody FinalizeImportRequest request) {
    final boolean updated =
        coordinator.finalizeRun(
            runId,
            request.workerId(),
            request.rowsFetched(),
            request.rowsInserted(),
            request.rowsSkipped(),
            request.rowsErrored(),
            request.errorDetails(),
            request.shouldMarkCompleted());
    if (!updated) {
      throw new ImportRunStateException(
          "import run is not claimed by worker: " + runId + " workerId=" + request.workerId());
    }
    return get(runId);
  }

  @PostMapping("/{run_id}/reconcile")
  public ReconcileResult reconcile(
      @PathVariable("run_id") UUID runId,
      @Valid @RequestBody(required = false) ReconcileRequest request) {
    return coordinator.reconcile(runId, request == null ? null : request.expectedCount());
  }

  @PostMapping("/{run_id}/rollback")
  public ResponseEntity<RollbackResult> rollback(
      @PathVariable("run_id") UUID runId, @Valid @RequestBody RollbackRequest request) {
    final RollbackResult result = coordinator.rollback(runId, request.reason());
    if (!result.success()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }
    return ResponseEntity.ok(result);
  }

  @PostMapping("/{run_id}/rows")
  public ImportRowResult addRow(
      @PathVariable("run_id") UUID runId, @Valid @RequestBody ImportRowRequest request) {
    return coordinator.insertRow(
        runId,
        request.workerId(),
        request.payload(),
        request.naturalKey().toArray(new String[0]));
  }
}
