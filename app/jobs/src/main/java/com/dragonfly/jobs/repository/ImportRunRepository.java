/*
 * どこで: Jobs データアクセス
 * 何を: import_runs の claim/heartbeat/finalize/reconcile/rollback 更新と参照を行う
 * なぜ: バッチ単位の排他と監査証跡を DB の一意制約と条件付き更新で担保するため
 */
package com.dragonfly.jobs.repository;

import static com.dragonfly.common.JdbcTimestampUtils.toInstant;
import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;

import com.dragonfly.jobs.model.ClaimResult;
import com.dragonfly.jobs.model.ClaimStatus;
import com.dragonfly.jobs.model.ImportRunRecord;
import com.dragonfly.jobs.model.ImportRunStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ImportRunRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * タプルの claim を 1 文で判定する。
   *
   * <p>新規なら挿入、FAILED/ROLLED_BACK/heartbeat 切れなら同じ run_id を奪い直す。それ以外は既存行から
   * DUPLICATE か IN_PROGRESS を返す。競合相手の行がまだスナップショットに見えない場合は空を返すので、呼び出し側で再試行する。
   */
  public Optional<ClaimResult> claim(
      UUID newRunId,
      String sourceSystem,
      String sourceBatchId,
      String fileHash,
      String filename,
      String importKind,
      String workerId,
      Instant now,
      Instant staleBefore) {
    final String sql =
        """
        WITH upserted AS (
          INSERT INTO import_runs (
            run_id, source_system, source_batch_id, file_hash, filename, import_kind,
            status, worker_id, claimed_at, heartbeat_at, created_at, updated_at
          ) VALUES (
            :runId, :sourceSystem, :sourceBatchId, :fileHash, :filename, :importKind,
            'CLAIMED', :workerId, :now, :now, :now, :now
          )
          ON CONFLICT (source_system, source_batch_id, file_hash) DO UPDATE
          SET status = 'CLAIMED',
              filename = EXCLUDED.filename,
              import_kind = EXCLUDED.import_kind,
              worker_id = EXCLUDED.worker_id,
              claimed_at = EXCLUDED.claimed_at,
              heartbeat_at = EXCLUDED.heartbeat_at,
              completed_at = NULL,
              reconciled_at = NULL,
              rows_fetched = NULL,
              rows_inserted = NULL,
              rows_skipped = NULL,
              rows_errored = NULL,
              error_details = jsonb_build_object(
                'takeover_reason',
                CASE WHEN import_runs.status IN ('CLAIMED', 'IN_PROGRESS')
                     THEN 'stale_lock'
                     ELSE 'reclaim_after_' || lower(import_runs.status)
                END,
                'previous_worker', import_runs.worker_id,
                'previous_status', import_runs.status,
                'previous_heartbeat_at', import_runs.heartbeat_at,
                'previous_error_details', import_runs.error_details),
              updated_at = EXCLUDED.updated_at
          WHERE import_runs.status IN ('FAILED', 'ROLLED_BACK')
             OR (import_runs.status IN ('CLAIMED', 'IN_PROGRESS')
                 AND import_runs.heartbeat_at < :staleBefore)
          RETURNING run_id
        )
        SELECT run_id, 'CLAIMED' AS claim_status
        FROM upserted
        UNION ALL
        SELECT run_id,
               CASE WHEN status = 'COMPLETED' THEN 'DUPLICATE' ELSE 'IN_PROGRESS' END AS claim_status
        FROM import_runs
        WHERE source_system = :sourceSystem
          AND source_batch_id = :sourceBatchId
          AND file_hash = :fileHash
          AND NOT EXISTS (SELECT 1 FROM upserted)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", newRunId)
            .addValue("sourceSystem", sourceSystem)
            .addValue("sourceBatchId", sourceBatchId)
            .addValue("fileHash", fileHash)
            .addValue("filename", filename)
            .addValue("importKind", importKind)
            .addValue("workerId", workerId)
            .addValue("now", toTimestamp(now))
            .addValue("staleBefore", toTimestamp(staleBefore));
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new ClaimResult(
                    rs.getObject("run_id", UUID.class),
                    ClaimStatus.valueOf(rs.getString("claim_status"))))
        .stream()
        .findFirst();
  }

  public int heartbeat(UUID runId, String workerId, Instant now) {
    // 奪われた claim を旧ワーカーが延命しないよう worker_id も照合する
    final String sql =
        """
        UPDATE import_runs
        SET heartbeat_at = :now,
            status = 'IN_PROGRESS',
            updated_at = :now
        WHERE run_id = :runId
          AND status IN ('CLAIMED', 'IN_PROGRESS')
          AND worker_id = :workerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("workerId", workerId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int finalizeRun(
      UUID runId,
      String workerId,
      ImportRunStatus status,
      int rowsFetched,
      int rowsInserted,
      int rowsSkipped,
      int rowsErrored,
      String errorDetailsJson,
      Instant now) {
    final String sql =
        """
        UPDATE import_runs
        SET status = :status,
            rows_fetched = :rowsFetched,
            rows_inserted = :rowsInserted,
            rows_skipped = :rowsSkipped,
            rows_errored = :rowsErrored,
            error_details = :errorDetails::jsonb,
            completed_at = :now,
            updated_at = :now
        WHERE run_id = :runId
          AND status IN ('CLAIMED', 'IN_PROGRESS')
          AND worker_id = :workerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("workerId", workerId)
            .addValue("status", status.name())
            .addValue("rowsFetched", rowsFetched)
            .addValue("rowsInserted", rowsInserted)
            .addValue("rowsSkipped", rowsSkipped)
            .addValue("rowsErrored", rowsErrored)
            .addValue("errorDetails", errorDetailsJson)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markReconciled(UUID runId, Instant now) {
    final String sql =
        """
        UPDATE import_runs
        SET reconciled_at = :now,
            updated_at = :now
        WHERE run_id = :runId
          AND status IN ('COMPLETED', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("runId", runId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markReconciliationFailed(UUID runId, String reconciliationJson, Instant now) {
    // 突合結果は既存の error_details にマージし、finalize 時の情報を消さない
    final String sql =
        """
        UPDATE import_runs
        SET status = 'FAILED',
            error_details = COALESCE(error_details, '{}'::jsonb) || :reconciliation::jsonb,
            reconciled_at = :now,
            updated_at = :now
        WHERE run_id = :runId
          AND status IN ('COMPLETED', 'FAILED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("reconciliation", reconciliationJson)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markRolledBack(UUID runId, String reason, Instant now) {
    final String sql =
        """
        UPDATE import_runs
        SET status = 'ROLLED_BACK',
            rolled_back_at = :now,
            rollback_reason = :reason,
            updated_at = :now
        WHERE run_id = :runId
          AND status <> 'ROLLED_BACK'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<ImportRunRecord> findById(UUID runId) {
    final String sql =
        """
        SELECT run_id, source_system, source_batch_id, file_hash, filename, import_kind, status,
               rows_fetched, rows_inserted, rows_skipped, rows_errored, worker_id,
               claimed_at, heartbeat_at, completed_at, reconciled_at, rolled_back_at,
               rollback_reason, error_details::text AS error_details_text, created_at, updated_at
        FROM import_runs
        WHERE run_id = :runId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("runId", runId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ImportRunRecord> findByIdForUpdate(UUID runId) {
    final String sql =
        """
        SELECT run_id, source_system, source_batch_id, file_hash, filename, import_kind, status,
               rows_fetched, rows_inserted, rows_skipped, rows_errored, worker_id,
               claimed_at, heartbeat_at, completed_at, reconciled_at, rolled_back_at,
               rollback_reason, error_details::text AS error_details_text, created_at, updated_at
        FROM import_runs
        WHERE run_id = :runId
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("runId", runId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ImportRunRecord> findRecent(int limit) {
    final String sql =
        """
        SELECT run_id, source_system, source_batch_id, file_hash, filename, import_kind, status,
               rows_fetched, rows_inserted, rows_skipped, rows_errored, worker_id,
               claimed_at, heartbeat_at, completed_at, reconciled_at, rolled_back_at,
               rollback_reason, error_details::text AS error_details_text, created_at, updated_at
        FROM import_runs
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ImportRunRecord> findStale(Instant staleBefore, int limit) {
    final String sql =
        """
        SELECT run_id, source_system, source_batch_id, file_hash, filename, import_kind, status,
               rows_fetched, rows_inserted, rows_skipped, rows_errored, worker_id,
               claimed_at, heartbeat_at, completed_at, reconciled_at, rolled_back_at,
               rollback_reason, error_details::text AS error_details_text, created_at, updated_at
        FROM import_runs
        WHERE status IN ('CLAIMED', 'IN_PROGRESS')
          AND heartbeat_at < :staleBefore
        ORDER BY heartbeat_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("staleBefore", toTimestamp(staleBefore))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countStale(Instant staleBefore) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM import_runs
        WHERE status IN ('CLAIMED', 'IN_PROGRESS')
          AND heartbeat_at < :staleBefore
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("staleBefore", toTimestamp(staleBefore));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private ImportRunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ImportRunRecord(
        rs.getObject("run_id", UUID.class),
        rs.getString("source_system"),
        rs.getString("source_batch_id"),
        rs.getString("file_hash"),
        rs.getString("filename"),
        rs.getString("import_kind"),
        ImportRunStatus.valueOf(rs.getString("status")),
        rs.getObject("rows_fetched", Integer.class),
        rs.getObject("rows_inserted", Integer.class),
        rs.getObject("rows_skipped", Integer.class),
        rs.getObject("rows_errored", Integer.class),
        rs.getString("worker_id"),
        toInstant(rs.getTimestamp("claimed_at")),
        toInstant(rs.getTimestamp("heartbeat_at")),
        toInstant(rs.getTimestamp("completed_at")),
        toInstant(rs.getTimestamp("reconciled_at")),
        toInstant(rs.getTimestamp("rolled_back_at")),
        rs.getString("rollback_reason"),
        rs.getString("error_details_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
