/*
 * どこで: Jobs データアクセス
 * 何を: worker_heartbeats の登録/更新/一覧を行う
 * なぜ: どのワーカーが生きているかを運用 API から確認できるようにするため
 */
package com.dragonfly.jobs.repository;

import static com.dragonfly.common.JdbcTimestampUtils.toInstant;
import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;

import com.dragonfly.jobs.model.WorkerHeartbeatRecord;
import com.dragonfly.jobs.model.WorkerStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WorkerHeartbeatRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(
      String workerId,
      String queueName,
      String hostname,
      WorkerStatus status,
      long jobsProcessed,
      long jobsFailed,
      Instant now) {
    final String sql =
        """
        INSERT INTO worker_heartbeats (
          worker_id, queue_name, hostname, status, jobs_processed, jobs_failed, started_at, last_seen_at
        ) VALUES (
          :workerId, :queueName, :hostname, :status, :jobsProcessed, :jobsFailed, :now, :now
        )
        ON CONFLICT (worker_id) DO UPDATE
        SET status = EXCLUDED.status,
            jobs_processed = EXCLUDED.jobs_processed,
            jobs_failed = EXCLUDED.jobs_failed,
            last_seen_at = EXCLUDED.last_seen_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("workerId", workerId)
            .addValue("queueName", queueName)
            .addValue("hostname", hostname)
            .addValue("status", status.name())
            .addValue("jobsProcessed", jobsProcessed)
            .addValue("jobsFailed", jobsFailed)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public List<WorkerHeartbeatRecord> findAll() {
    final String sql =
        """
        SELECT worker_id, queue_name, hostname, status, jobs_processed, jobs_failed,
               started_at, last_seen_at
        FROM worker_heartbeats
        ORDER BY last_seen_at DESC
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int deleteStoppedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM worker_heartbeats
        WHERE status = 'STOPPED'
          AND last_seen_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private WorkerHeartbeatRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WorkerHeartbeatRecord(
        rs.getString("worker_id"),
        rs.getString("queue_name"),
        rs.getString("hostname"),
        WorkerStatus.valueOf(rs.getString("status")),
        rs.getLong("jobs_processed"),
        rs.getLong("jobs_failed"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("last_seen_at")));
  }
}
