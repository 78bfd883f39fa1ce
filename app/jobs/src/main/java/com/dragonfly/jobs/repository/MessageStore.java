/*
 * どこで: Jobs データアクセス
 * 何を: queue_messages の enqueue/リース読み出し/archive/release/集計を担う
 * なぜ: 可視性タイムアウト付きのキューを単一 SQL の原子操作で実現するため
 */
package com.dragonfly.jobs.repository;

import static com.dragonfly.common.JdbcTimestampUtils.toInstant;
import static com.dragonfly.common.JdbcTimestampUtils.toTimestamp;

import com.dragonfly.jobs.model.QueueMessage;
import com.dragonfly.jobs.model.QueueMetrics;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MessageStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long enqueue(String queueName, String payloadJson, Instant now) {
    // enqueue 直後から読めるよう visibility_deadline は now にする
    final String sql =
        """
        INSERT INTO queue_messages (
          queue_name,
          payload,
          enqueued_at,
          read_count,
          visibility_deadline
        ) VALUES (
          :queueName,
          :payload::jsonb,
          :now,
          0,
          :now
        )
        RETURNING msg_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("payload", payloadJson)
            .addValue("now", toTimestamp(now));
    final Long msgId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (msgId == null) {
      throw new IllegalStateException("enqueue did not return msg_id queue=" + queueName);
    }
    return msgId;
  }

  public List<QueueMessage> read(
      String queueName, int batchSize, Duration visibilityTimeout, Instant now) {
    // 読み出しとリース設定を 1 文で行い、SKIP LOCKED で同時読み出しの二重配信を防ぐ
    final String sql =
        """
        WITH cte AS (
          SELECT msg_id
          FROM queue_messages
          WHERE queue_name = :queueName
            AND visibility_deadline <= :now
          ORDER BY msg_id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        ),
        leased AS (
          UPDATE queue_messages m
          SET visibility_deadline = :deadline,
              read_count = m.read_count + 1
          FROM cte
          WHERE m.msg_id = cte.msg_id
          RETURNING m.msg_id, m.queue_name, m.payload::text AS payload_text,
                    m.enqueued_at, m.read_count, m.visibility_deadline
        )
        SELECT msg_id, queue_name, payload_text, enqueued_at, read_count, visibility_deadline
        FROM leased
        ORDER BY msg_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("now", toTimestamp(now))
            .addValue("deadline", toTimestamp(now.plus(visibilityTimeout)))
            .addValue("limit", batchSize);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean archive(String queueName, long msgId, Instant archivedAt) {
    // キューから削除した行をそのままアーカイブへ移す
    final String sql =
        """
        WITH moved AS (
          DELETE FROM queue_messages
          WHERE queue_name = :queueName
            AND msg_id = :msgId
          RETURNING msg_id, queue_name, payload, enqueued_at, read_count
        )
        INSERT INTO queue_messages_archive (
          msg_id, queue_name, payload, enqueued_at, read_count, archived_at
        )
        SELECT msg_id, queue_name, payload, enqueued_at, read_count, :archivedAt
        FROM moved
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("msgId", msgId)
            .addValue("archivedAt", toTimestamp(archivedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public boolean delete(String queueName, long msgId) {
    final String sql =
        """
        DELETE FROM queue_messages
        WHERE queue_name = :queueName
          AND msg_id = :msgId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("queueName", queueName).addValue("msgId", msgId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  public boolean release(String queueName, long msgId, Instant now) {
    final String sql =
        """
        UPDATE queue_messages
        SET visibility_deadline = :now
        WHERE queue_name = :queueName
          AND msg_id = :msgId
          AND visibility_deadline > :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("msgId", msgId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<QueueMessage> findById(String queueName, long msgId) {
    final String sql =
        """
        SELECT msg_id, queue_name, payload::text AS payload_text,
               enqueued_at, read_count, visibility_deadline
        FROM queue_messages
        WHERE queue_name = :queueName
          AND msg_id = :msgId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("queueName", queueName).addValue("msgId", msgId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean isArchived(long msgId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM queue_messages_archive
        WHERE msg_id = :msgId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("msgId", msgId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public QueueMetrics metrics(String queueName, Instant now) {
    final String sql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE visibility_deadline > :now) AS in_flight,
               COUNT(*) FILTER (WHERE visibility_deadline <= :now) AS readable,
               MIN(enqueued_at) AS oldest_enqueued_at
        FROM queue_messages
        WHERE queue_name = :queueName
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("queueName", queueName)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) -> {
          final Instant oldest = toInstant(rs.getTimestamp("oldest_enqueued_at"));
          final long oldestAgeSeconds =
              oldest == null ? 0L : Math.max(0L, Duration.between(oldest, now).toSeconds());
          return new QueueMetrics(
              queueName,
              rs.getLong("total"),
              oldestAgeSeconds,
              rs.getLong("in_flight"),
              rs.getLong("readable"));
        });
  }

  public List<String> listQueues() {
    final String sql =
        """
        SELECT DISTINCT queue_name
        FROM queue_messages
        ORDER BY queue_name
        """;
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), String.class);
  }

  public int deleteArchivedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM queue_messages_archive
        WHERE archived_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private QueueMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new QueueMessage(
        rs.getLong("msg_id"),
        rs.getString("queue_name"),
        rs.getString("payload_text"),
        toInstant(rs.getTimestamp("enqueued_at")),
        rs.getInt("read_count"),
        toInstant(rs.getTimestamp("visibility_deadline")));
  }
}
