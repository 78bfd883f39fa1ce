/*
 * どこで: BatchClaimCoordinator の統合テスト
 * 何を: claim の判定(CLAIMED/DUPLICATE/IN_PROGRESS)・stale 引き継ぎ・突合・ロールバック・行の重複排除を検証する
 * なぜ: 同じファイルの二重取込と取りこぼしが起きないことを実 DB で保証するため
 */
package com.dragonfly.jobs.service;

import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dragonfly.jobs.AbstractPostgresContainerTest;
import com.dragonfly.jobs.TestTables;
import com.dragonfly.jobs.model.ClaimResult;
import com.dragonfly.jobs.model.ClaimStatus;
import com.dragonfly.jobs.model.ImportRowResult;
import com.dragonfly.jobs.model.ImportRowStatus;
import com.dragonfly.jobs.model.ImportRunRecord;
import com.dragonfly.jobs.model.ImportRunStatus;
import com.dragonfly.jobs.model.ReconcileResult;
import com.dragonfly.jobs.model.RollbackResult;
import com.dragonfly.jobs.repository.ImportRowRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(
    properties = {"jobs.import.staleness-window=30m", "jobs.import.heartbeat-interval=100ms"})
@ActiveProfiles("test")
class BatchClaimCoordinatorTest extends AbstractPostgresContainerTest {

  private static final String SOURCE = "simplicity";
  private static final String BATCH = "b1";
  private static final String HASH = "hashX";
  private static final String WORKER_A = "worker-a";
  private static final String WORKER_B = "worker-b";
  private static final String WORKER_C = "worker-c";

  @Autowired private BatchClaimCoordinator coordinator;

  @Autowired private ImportRowRepository importRowRepository;

  @Autowired private ObjectMapper objectMapper;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    TestTables.truncateAll(jdbcTemplate);
  }

  @Test
  void concurrentClaimantSeesInProgressAndLateClaimantSeesDuplicate() {
    final ClaimResult a = claim(WORKER_A);
    final ClaimResult b = claim(WORKER_B);

    assertThat(a.status()).isEqualTo(ClaimStatus.CLAIMED);
    assertThat(b).isEqualTo(new ClaimResult(a.runId(), ClaimStatus.IN_PROGRESS));

    coordinator.finalizeRun(a.runId(), WORKER_A, 100, 100, 0, 0, null, true);
    final ClaimResult c = claim(WORKER_C);

    assertThat(c).isEqualTo(new ClaimResult(a.runId(), ClaimStatus.DUPLICATE));
    assertThat(TestTables.count(jdbcTemplate, "import_runs")).isEqualTo(1);
    final ImportRunRecord run = coordinator.find(a.runId()).orElseThrow();
    assertThat(run.status()).isEqualTo(ImportRunStatus.COMPLETED);
    // 重複判定は既存 run に触れない
    assertThat(run.workerId()).isEqualTo(WORKER_A);
    assertThat(run.rowsInserted()).isEqualTo(100);
  }

  @Test
  void duplicateClaimAfterCompletionHasNoSideEffects() {
    final ClaimResult first = claim(WORKER_A);
    coordinator.insertRow(first.runId(), WORKER_A, payload(1), "A-1");
    coordinator.finalizeRun(first.runId(), WORKER_A, 1, 1, 0, 0, null, true);
    final ImportRunRecord before = coordinator.find(first.runId()).orElseThrow();

    final ClaimResult second = claim(WORKER_B);

    assertThat(second.status()).isEqualTo(ClaimStatus.DUPLICATE);
    assertThat(second.runId()).isEqualTo(first.runId());
    assertThat(TestTables.count(jdbcTemplate, "import_runs")).isEqualTo(1);
    assertThat(TestTables.count(jdbcTemplate, "import_rows")).isEqualTo(1);
    assertThat(coordinator.find(first.runId()).orElseThrow()).isEqualTo(before);
  }

  @Test
  void sameDedupeKeyIsPersistedOnce() {
    final ClaimResult run = claim(WORKER_A);

    final ImportRowResult first =
        coordinator.insertRow(run.runId(), WORKER_A, payload(1), "Case-1", "NY");
    // 表記揺れは正規化されて同じキーになる
    final ImportRowResult second =
        coordinator.insertRow(run.runId(), WORKER_A, payload(2), "  case-1 ", "ny");

    assertThat(first.inserted()).isTrue();
    assertThat(second.inserted()).isFalse();
    assertThat(second.dedupeKey()).isEqualTo(first.dedupeKey());
    assertThat(importRowRepository.countByRun(run.runId())).isEqualTo(1);
  }

  @Test
  void staleClaimIsTakenOverByAnotherWorker() throws Exception {
    final ClaimResult a = claim(WORKER_A);
    coordinator.heartbeat(a.runId(), WORKER_A);
    makeStale(a.runId(), Duration.ofMinutes(31));

    final ClaimResult b = claim(WORKER_B);

    assertThat(b).isEqualTo(new ClaimResult(a.runId(), ClaimStatus.CLAIMED));
    final ImportRunRecord run = coordinator.find(a.runId()).orElseThrow();
    assertThat(run.workerId()).isEqualTo(WORKER_B);
    assertThat(run.status()).isEqualTo(ImportRunStatus.CLAIMED);
    final JsonNode details = objectMapper.readTree(run.errorDetailsJson());
    assertThat(details.path("takeover_reason").asText()).isEqualTo("stale_lock");
    assertThat(details.path("previous_worker").asText()).isEqualTo(WORKER_A);
    assertThat(details.path("previous_status").asText()).isEqualTo("IN_PROGRESS");
    // 旧ワーカーは奪われた claim を延命できない
    assertThat(coordinator.heartbeat(a.runId(), WORKER_A)).isFalse();
    assertThat(coordinator.heartbeat(a.runId(), WORKER_B)).isTrue();
  }

  @Test
  void supersededWorkerCannotFinalizeOrAddRows() {
    final ClaimResult a = claim(WORKER_A);
    coordinator.insertRow(a.runId(), WORKER_A, payload(1), "row-1");
    makeStale(a.runId(), Duration.ofMinutes(31));
    claim(WORKER_B);

    // 旧ワーカーが復帰しても、奪われた run を確定したり行を足したりできない
    assertThat(coordinator.finalizeRun(a.runId(), WORKER_A, 1, 1, 0, 0, null, true)).isFalse();
    assertThatThrownBy(() -> coordinator.insertRow(a.runId(), WORKER_A, payload(2), "row-2"))
        .isInstanceOf(ImportRunStateException.class);

    final ImportRunRecord taken = coordinator.find(a.runId()).orElseThrow();
    assertThat(taken.status()).isEqualTo(ImportRunStatus.CLAIMED);
    assertThat(taken.workerId()).isEqualTo(WORKER_B);
    assertThat(importRowRepository.countByRun(a.runId())).isEqualTo(1);
    assertThat(claim(WORKER_C).status()).isEqualTo(ClaimStatus.IN_PROGRESS);

    assertThat(coordinator.finalizeRun(a.runId(), WORKER_B, 1, 1, 0, 0, null, true)).isTrue();
    assertThat(claim(WORKER_C).status()).isEqualTo(ClaimStatus.DUPLICATE);
  }

  @Test
  void backgroundHeartbeatKeepsClaimAliveUntilItIsTakenOver() throws Exception {
    final ClaimResult a = claim(WORKER_A);
    makeStale(a.runId(), Duration.ofMinutes(10));
    final Instant silentSince = coordinator.find(a.runId()).orElseThrow().heartbeatAt();

    try (ImportHeartbeat heartbeat = coordinator.startHeartbeat(a.runId(), WORKER_A)) {
      awaitUntil(
          () -> coordinator.find(a.runId()).orElseThrow().heartbeatAt().isAfter(silentSince));
      assertThat(heartbeat.isClaimLost()).isFalse();

      // 別ワーカーに奪われた後は延命できない
      jdbcTemplate.update(
          "UPDATE import_runs SET worker_id = :workerId WHERE run_id = :runId",
          new MapSqlParameterSource().addValue("workerId", WORKER_B).addValue("runId", a.runId()));
      awaitUntil(heartbeat::isClaimLost);
    }
    assertThat(coordinator.find(a.runId()).orElseThrow().workerId()).isEqualTo(WORKER_B);
  }

  @Test
  void claimWithinStalenessWindowIsNotTakenOver() {
    final ClaimResult a = claim(WORKER_A);
    makeStale(a.runId(), Duration.ofMinutes(29));

    final ClaimResult b = claim(WORKER_B);

    assertThat(b.status()).isEqualTo(ClaimStatus.IN_PROGRESS);
    assertThat(coordinator.find(a.runId()).orElseThrow().workerId()).isEqualTo(WORKER_A);
  }

  @Test
  void heartbeatMovesClaimToInProgress() {
    final ClaimResult a = claim(WORKER_A);

    assertThat(coordinator.heartbeat(a.runId(), WORKER_A)).isTrue();
    assertThat(coordinator.find(a.runId()).orElseThrow().status())
        .isEqualTo(ImportRunStatus.IN_PROGRESS);
    assertThat(coordinator.heartbeat(UUID.randomUUID(), WORKER_A)).isFalse();
  }

  @Test
  void reconcileMismatchFailsRun() throws Exception {
    final ClaimResult run = claim(WORKER_A);
    for (int i = 0; i < 97; i++) {
      coordinator.insertRow(run.runId(), WORKER_A, payload(i), "row-" + i);
    }
    coordinator.finalizeRun(run.runId(), WORKER_A, 100, 97, 0, 3, null, true);

    final ReconcileResult result = coordinator.reconcile(run.runId(), 100);

    assertThat(result.valid()).isFalse();
    assertThat(result.expectedCount()).isEqualTo(100);
    assertThat(result.actualCount()).isEqualTo(97);
    assertThat(result.delta()).isEqualTo(3);
    final ImportRunRecord record = coordinator.find(run.runId()).orElseThrow();
    assertThat(record.status()).isEqualTo(ImportRunStatus.FAILED);
    assertThat(record.reconciledAt()).isNotNull();
    final JsonNode details = objectMapper.readTree(record.errorDetailsJson());
    assertThat(details.path("reconciliation_failed").asBoolean()).isTrue();
    assertThat(details.path("delta").asInt()).isEqualTo(3);
  }

  @Test
  void reconcileDefaultsToRowsFetchedAndCompletesOnMatch() {
    final ClaimResult run = claim(WORKER_A);
    coordinator.insertRow(run.runId(), WORKER_A, payload(1), "row-1");
    coordinator.insertRow(run.runId(), WORKER_A, payload(2), "row-2");
    coordinator.finalizeRun(run.runId(), WORKER_A, 2, 2, 0, 0, null, true);

    final ReconcileResult result = coordinator.reconcile(run.runId(), null);

    assertThat(result.valid()).isTrue();
    assertThat(result.delta()).isZero();
    final ImportRunRecord record = coordinator.find(run.runId()).orElseThrow();
    assertThat(record.status()).isEqualTo(ImportRunStatus.COMPLETED);
    assertThat(record.reconciledAt()).isNotNull();
  }

  @Test
  void reconcileRejectsRunThatIsNotFinalized() {
    final ClaimResult run = claim(WORKER_A);

    assertThatThrownBy(() -> coordinator.reconcile(run.runId(), null))
        .isInstanceOf(ImportRunStateException.class);

    final ImportRunRecord record = coordinator.find(run.runId()).orElseThrow();
    assertThat(record.status()).isEqualTo(ImportRunStatus.CLAIMED);
    assertThat(record.reconciledAt()).isNull();
    // 持ち主はそのまま確定できる
    assertThat(coordinator.finalizeRun(run.runId(), WORKER_A, 0, 0, 0, 0, null, true)).isTrue();
  }

  @Test
  void fatalErrorDetailsFinalizeAsFailed() {
    final ClaimResult run = claim(WORKER_A);

    final boolean updated =
        coordinator.finalizeRun(
            run.runId(),
            WORKER_A,
            10,
            0,
            0,
            10,
            objectMapper.createObjectNode().put("fatal", true).put("reason", "bad header"),
            true);

    assertThat(updated).isTrue();
    assertThat(coordinator.find(run.runId()).orElseThrow().status())
        .isEqualTo(ImportRunStatus.FAILED);
    // 確定済みの run は再度 finalize できない
    assertThat(coordinator.finalizeRun(run.runId(), WORKER_A, 1, 1, 0, 0, null, true)).isFalse();
  }

  @Test
  void rollbackOfCompletedRunKeepsRowsAsSoftDeleted() {
    final ClaimResult run = claim(WORKER_A);
    for (int i = 0; i < 5; i++) {
      coordinator.insertRow(run.runId(), WORKER_A, payload(i), "row-" + i);
    }
    coordinator.finalizeRun(run.runId(), WORKER_A, 5, 5, 0, 0, null, true);

    final RollbackResult result = coordinator.rollback(run.runId(), "wrong source file");
    final RollbackResult again = coordinator.rollback(run.runId(), "wrong source file");

    assertThat(result).isEqualTo(new RollbackResult(true, 5));
    assertThat(again).isEqualTo(new RollbackResult(true, 0));
    final ImportRunRecord record = coordinator.find(run.runId()).orElseThrow();
    assertThat(record.status()).isEqualTo(ImportRunStatus.ROLLED_BACK);
    assertThat(record.rollbackReason()).isEqualTo("wrong source file");
    assertThat(importRowRepository.countByRun(run.runId())).isEqualTo(5);
    assertThat(importRowRepository.countByRunAndStatus(run.runId(), ImportRowStatus.ROLLED_BACK))
        .isEqualTo(5);
    assertThatThrownBy(() -> coordinator.reconcile(run.runId(), null))
        .isInstanceOf(ImportRunStateException.class);
  }

  @Test
  void rollbackOfUnknownRunReportsFailure() {
    assertThat(coordinator.rollback(UUID.randomUUID(), "cleanup"))
        .isEqualTo(new RollbackResult(false, 0));
  }

  @Test
  void rolledBackBatchCanBeReimported() {
    final ClaimResult first = claim(WORKER_A);
    coordinator.insertRow(first.runId(), WORKER_A, payload(1), "row-1");
    coordinator.finalizeRun(first.runId(), WORKER_A, 1, 1, 0, 0, null, true);
    coordinator.rollback(first.runId(), "bad mapping");

    final ClaimResult second = claim(WORKER_B);
    final ImportRowResult row =
        coordinator.insertRow(second.runId(), WORKER_B, payload(1), "row-1");

    assertThat(second).isEqualTo(new ClaimResult(first.runId(), ClaimStatus.CLAIMED));
    assertThat(row.inserted()).isTrue();
    assertThat(importRowRepository.countByRunAndStatus(second.runId(), ImportRowStatus.PENDING))
        .isEqualTo(1);
  }

  @Test
  void rowsCannotBeAddedToFinishedRun() {
    final ClaimResult run = claim(WORKER_A);
    coordinator.finalizeRun(run.runId(), WORKER_A, 0, 0, 0, 0, null, true);

    assertThatThrownBy(() -> coordinator.insertRow(run.runId(), WORKER_A, payload(1), "row-1"))
        .isInstanceOf(ImportRunStateException.class);
    assertThatThrownBy(
            () -> coordinator.insertRow(UUID.randomUUID(), WORKER_A, payload(1), "row-1"))
        .isInstanceOf(ImportRunNotFoundException.class);
  }

  @Test
  void staleRunsListsOnlySilentClaims() {
    final ClaimResult stale = coordinator.claim(SOURCE, "old", HASH, null, null, WORKER_A);
    claim(WORKER_B);
    makeStale(stale.runId(), Duration.ofHours(1));

    assertThat(coordinator.staleRuns(10))
        .extracting(ImportRunRecord::runId)
        .containsExactly(stale.runId());
  }

  private void awaitUntil(BooleanSupplier condition) throws InterruptedException {
    final long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 5s");
      }
      Thread.sleep(20);
    }
  }

  private ClaimResult claim(String workerId) {
    return coordinator.claim(SOURCE, BATCH, HASH, "b1.csv", "cases", workerId);
  }

  private JsonNode payload(int index) {
    return objectMapper.createObjectNode().put("index", index);
  }

  private void makeStale(UUID runId, Duration silence) {
    jdbcTemplate.update(
        "UPDATE import_runs SET heartbeat_at = :heartbeatAt WHERE run_id = :runId",
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("heartbeatAt", toTimestamp(Instant.now().minus(silence))));
  }
}
