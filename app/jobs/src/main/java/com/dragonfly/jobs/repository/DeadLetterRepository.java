/*
 * どこで: Jobs データアクセス
 * 何を: dead_letter_jobs の登録/一覧/取得/削除を行う
 * なぜ: 隔離したジョブを運用者が確認して再投入できるようにするため
 */
package com.dragonfly.jobs.repository;

import static com.dragonfly.common.JdbcTimestampUtils.toInstant;
import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;

import com.dragonfly.jobs.model.DeadLetterEntry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(
      String originalQueue,
      Long originalJobId,
      String idempotencyKey,
      String payloadJson,
      String errorMessage,
      int attemptCount,
      String workerId,
      Instant movedAt) {
    final String sql =
        """
        INSERT INTO dead_letter_jobs (
          original_queue,
          original_job_id,
          idempotency_key,
          original_payload,
          error_message,
          attempt_count,
          worker_id,
          moved_at
        ) VALUES (
          :originalQueue,
          :originalJobId,
          :idempotencyKey,
          :payload::jsonb,
          :errorMessage,
          :attemptCount,
          :workerId,
          :movedAt
        )
        RETURNING dlq_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("originalQueue", originalQueue)
            .addValue("originalJobId", originalJobId)
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("payload", payloadJson)
            .addValue("errorMessage", errorMessage)
            .addValue("attemptCount", attemptCount)
            .addValue("workerId", workerId)
            .addValue("movedAt", toTimestamp(movedAt));
    final Long dlqId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (dlqId == null) {
      throw new IllegalStateException("dead letter insert did not return dlq_id");
    }
    return dlqId;
  }

  public List<DeadLetterEntry> findAll(int limit) {
    final String sql =
        """
        SELECT dlq_id, original_queue, original_job_id, idempotency_key,
               original_payload::text AS payload_text, error_message, attempt_count,
               worker_id, moved_at
        FROM dead_letter_jobs
        ORDER BY moved_at DESC, dlq_id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<DeadLetterEntry> findByQueue(String originalQueue, int limit) {
    final String sql =
        """
        SELECT dlq_id, original_queue, original_job_id, idempotency_key,
               original_payload::text AS payload_text, error_message, attempt_count,
               worker_id, moved_at
        FROM dead_letter_jobs
        WHERE original_queue = :originalQueue
        ORDER BY moved_at DESC, dlq_id DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("originalQueue", originalQueue)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<DeadLetterEntry> findById(long dlqId) {
    final String sql =
        """
        SELECT dlq_id, original_queue, original_job_id, idempotency_key,
               original_payload::text AS payload_text, error_message, attempt_count,
               worker_id, moved_at
        FROM dead_letter_jobs
        WHERE dlq_id = :dlqId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dlqId", dlqId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<DeadLetterEntry> findByIdForUpdate(long dlqId) {
    // 同じエントリの二重 replay を防ぐため行ロックを取る
    final String sql =
        """
        SELECT dlq_id, original_queue, original_job_id, idempotency_key,
               original_payload::text AS payload_text, error_message, attempt_count,
               worker_id, moved_at
        FROM dead_letter_jobs
        WHERE dlq_id = :dlqId
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dlqId", dlqId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int delete(long dlqId) {
    final String sql =
        """
        DELETE FROM dead_letter_jobs
        WHERE dlq_id = :dlqId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dlqId", dlqId);
    return jdbcTemplate.update(sql, params);
  }

  public int countByQueue(String originalQueue) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM dead_letter_jobs
        WHERE original_queue = :originalQueue
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("originalQueue", originalQueue);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private DeadLetterEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long rawJobId = rs.getLong("original_job_id");
    final Long originalJobId = rs.wasNull() ? null : rawJobId;
    return new DeadLetterEntry(
        rs.getLong("dlq_id"),
        rs.getString("original_queue"),
        originalJobId,
        rs.getString("idempotency_key"),
        rs.getString("payload_text"),
        rs.getString("error_message"),
        rs.getInt("attempt_count"),
        rs.getString("worker_id"),
        toInstant(rs.getTimestamp("moved_at")));
  }
}
