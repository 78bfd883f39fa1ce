/*
 * どこで: Jobs データアクセス
 * 何を: import_rows の insert-or-ignore/件数集計/論理削除を行う
 * なぜ: 行単位の冪等性と rollback 時の監査証跡を両立するため
 */
package com.dragonfly.jobs.repository;

import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;

import com.dragonfly.jobs.model.ImportRowStatus;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ImportRowRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(
      UUID runId, String sourceSystem, String dedupeKey, String payloadJson, Instant now) {
    // 同じ dedupe_key は何度来ても 1 行だけ残す。ROLLED_BACK の行だけは新しい run で取り込み直せる
    final String sql =
        """
        INSERT INTO import_rows (
          import_run_id, source_system, dedupe_key, payload, status, created_at, updated_at
        ) VALUES (
          :runId, :sourceSystem, :dedupeKey, :payload::jsonb, 'PENDING', :now, :now
        )
        ON CONFLICT (dedupe_key) DO UPDATE
        SET import_run_id = EXCLUDED.import_run_id,
            payload = EXCLUDED.payload,
            status = 'PENDING',
            error_code = NULL,
            error_message = NULL,
            updated_at = EXCLUDED.updated_at
        WHERE import_rows.status = 'ROLLED_BACK'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("sourceSystem", sourceSystem)
            .addValue("dedupeKey", dedupeKey)
            .addValue("payload", payloadJson)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int countActiveByRun(UUID runId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM import_rows
        WHERE import_run_id = :runId
          AND status <> 'ROLLED_BACK'
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("runId", runId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int countByRun(UUID runId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM import_rows
        WHERE import_run_id = :runId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("runId", runId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int countByRunAndStatus(UUID runId, ImportRowStatus status) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM import_rows
        WHERE import_run_id = :runId
          AND status = :status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("runId", runId).addValue("status", status.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int markRolledBackByRun(UUID runId, Instant now) {
    final String sql =
        """
        UPDATE import_rows
        SET status = 'ROLLED_BACK',
            updated_at = :now
        WHERE import_run_id = :runId
          AND status <> 'ROLLED_BACK'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("runId", runId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }
}
