/*
 * どこで: Jobs サービス層
 * 何を: 処理中ジョブのメタデータと後続キューへの送信バッファを提供する
 * なぜ: 後続ジョブの enqueue を完了/ack と同じトランザクションに載せるため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.JobEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class JobContext {

  private final JobEnvelope envelope;
  private final long msgId;
  private final int readCount;
  private final String workerId;
  private final Instant now;
  private final List<FollowUpJob> followUps = new ArrayList<>();

  public JobContext(JobEnvelope envelope, long msgId, int readCount, String workerId, Instant now) {
    this.envelope = envelope;
    this.msgId = msgId;
    this.readCount = readCount;
    this.workerId = workerId;
    this.now = now;
  }

  public long msgId() {
    return msgId;
  }

  public int readCount() {
    return readCount;
  }

  public String workerId() {
    return workerId;
  }

  /** 後続キューへ送る。実際の enqueue は処理成功時にまとめて行う。 */
  public void sendToQueue(String queueName, JobEnvelope next) {
    if (queueName == null || queueName.isBlank()) {
      throw new IllegalArgumentException("queueName is required");
    }
    final List<String> invalid = next.invalidFields();
    if (!invalid.isEmpty()) {
      throw new InvalidEnvelopeException(invalid);
    }
    followUps.add(new FollowUpJob(queueName, next));
  }

  /** org_id と trace_id を引き継いだ後続ジョブの封筒を作る。 */
  public JobEnvelope childEnvelope(
      String idempotencyKey, String entityType, String entityId, JsonNode payload) {
    return new JobEnvelope(
        UUID.randomUUID().toString(),
        envelope.traceId(),
        envelope.orgId(),
        idempotencyKey,
        entityType,
        entityId,
        0,
        now,
        payload);
  }

  public List<FollowUpJob> followUps() {
    return List.copyOf(followUps);
  }
}
