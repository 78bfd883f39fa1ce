/*
 * どこで: Jobs データアクセス
 * 何を: processed_jobs の claim/完了/失敗/参照を行う
 * なぜ: 冪等キーの一意制約だけで exactly-once を保証するため
 */
package com.dragonfly.jobs.repository;

import com.dragonfly.jobs.model.ProcessedJobRecord;
import com.dragonfly.jobs.model.ProcessedJobStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;

import static com.dragonfly.common.JdbcTimestampUtils.toInstant;
import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class ProcessedJobRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * 新規キーなら PROCESSING で挿入する。FAILED と stale な PROCESSING は同じ行を奪い直す。
     *
     * @return 自分が claim できた場合のみ行を返す
     */
    public Optional<ProcessedJobRecord> claim(
            String idempotencyKey,
            String queueName,
            long msgId,
            String workerId,
            Instant now,
            Instant staleBefore) {
        String sql = """
                INSERT INTO processed_jobs (
                  idempotency_key, queue_name, msg_id, worker_id, status, attempts, created_at, updated_at
                ) VALUES (
                  :idempotencyKey, :queueName, :msgId, :workerId, 'PROCESSING', 0, :now, :now
                )
                ON CONFLICT (idempotency_key) DO UPDATE
                SET status = 'PROCESSING',
                    queue_name = EXCLUDED.queue_name,
                    msg_id = EXCLUDED.msg_id,
                    worker_id = EXCLUDED.worker_id,
                    updated_at = EXCLUDED.updated_at
                WHERE processed_jobs.status = 'FAILED'
                   OR (processed_jobs.status = 'PROCESSING' AND processed_jobs.updated_at < :staleBefore)
                RETURNING idempotency_key, queue_name, msg_id, worker_id, status, attempts,
                          result::text AS result_text, last_error, created_at, updated_at
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("idempotencyKey", idempotencyKey)
                .addValue("queueName", queueName)
                .addValue("msgId", msgId)
                .addValue("workerId", workerId)
                .addValue("now", toTimestamp(now))
                .addValue("staleBefore", toTimestamp(staleBefore));
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    public Optional<ProcessedJobRecord> findByKey(String idempotencyKey) {
        String sql = """
                SELECT idempotency_key, queue_name, msg_id, worker_id, status, attempts,
                       result::text AS result_text, last_error, created_at, updated_at
                FROM processed_jobs
                WHERE idempotency_key = :idempotencyKey
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("idempotencyKey", idempotencyKey);
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    public int markCompleted(
            String idempotencyKey, long msgId, String workerId, String resultJson, Instant now) {
        String sql = """
                UPDATE processed_jobs
                SET status = 'COMPLETED',
                    result = :result::jsonb,
                    last_error = NULL,
                    updated_at = :now
                WHERE idempotency_key = :idempotencyKey
                  AND status = 'PROCESSING'
                  AND msg_id = :msgId
                  AND worker_id = :workerId
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("idempotencyKey", idempotencyKey)
                .addValue("msgId", msgId)
                .addValue("workerId", workerId)
                .addValue("result", resultJson)
                .addValue("now", toTimestamp(now));
        return jdbcTemplate.update(sql, params);
    }

    /**
     * attempts を 1 進めて FAILED にする。
     *
     * @return 更新後の attempts。claim を失っていた場合は空
     */
    public OptionalInt markFailed(
            String idempotencyKey, long msgId, String workerId, String error, Instant now) {
        String sql = """
                UPDATE processed_jobs
                SET status = 'FAILED',
                    attempts = attempts + 1,
                    last_error = :error,
                    updated_at = :now
                WHERE idempotency_key = :idempotencyKey
                  AND status = 'PROCESSING'
                  AND msg_id = :msgId
                  AND worker_id = :workerId
                RETURNING attempts
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("idempotencyKey", idempotencyKey)
                .addValue("msgId", msgId)
                .addValue("workerId", workerId)
                .addValue("error", error)
                .addValue("now", toTimestamp(now));
        List<Integer> attempts = jdbcTemplate.queryForList(sql, params, Integer.class);
        return attempts.isEmpty() ? OptionalInt.empty() : OptionalInt.of(attempts.get(0));
    }

    public int deleteCompletedOlderThan(Instant threshold) {
        String sql = """
                DELETE FROM processed_jobs
                WHERE status = 'COMPLETED'
                  AND updated_at < :threshold
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("threshold", toTimestamp(threshold));
        return jdbcTemplate.update(sql, params);
    }

    public int countUnfinishedOlderThan(Instant threshold) {
        String sql = """
                SELECT COUNT(*)
                FROM processed_jobs
                WHERE status IN ('PROCESSING', 'FAILED')
                  AND updated_at < :threshold
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("threshold", toTimestamp(threshold));
        Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
        return count == null ? 0 : count;
    }

    private ProcessedJobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        long rawMsgId = rs.getLong("msg_id");
        Long msgId = rs.wasNull() ? null : rawMsgId;
        return new ProcessedJobRecord(
                rs.getString("idempotency_key"),
                rs.getString("queue_name"),
                msgId,
                rs.getString("worker_id"),
                ProcessedJobStatus.valueOf(rs.getString("status")),
                rs.getInt("attempts"),
                rs.getString("result_text"),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }
}
