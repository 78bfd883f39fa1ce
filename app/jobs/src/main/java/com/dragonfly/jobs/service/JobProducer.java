/*
 * どこで: Jobs サービス層
 * 何を: 封筒を検証してキューへ投入する
 * なぜ: 不正な封筒をリトライさせず、投入時点で dead letter に隔離するため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.common.TraceIds;
import com.dragonfly.jobs.config.JobWorkerProperties;
import com.dragonfly.jobs.model.JobEnvelope;
import com.dragonfly.jobs.repository.DeadLetterRepository;
import com.dragonfly.jobs.repository.MessageStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JobProducer {

  private static final Logger logger = LoggerFactory.getLogger(JobProducer.class);
  private static final int DEAD_LETTER_KEY_MAX_LENGTH = 600;

  private final MessageStore messageStore;
  private final DeadLetterRepository deadLetterRepository;
  private final JobWorkerProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * 封筒を検証してキューへ投入する。
   *
   * @return 採番された msg_id
   * @throws InvalidEnvelopeException 必須フィールドが欠けている場合。dead letter への記録はコミットされる
   */
  @Transactional(noRollbackFor = InvalidEnvelopeException.class)
  public long enqueue(String queueName, JobEnvelope envelope) {
    requireQueueName(queueName);
    final Instant now = Instant.now(clock);
    final List<String> invalid = envelope.invalidFields();
    if (!invalid.isEmpty()) {
      final InvalidEnvelopeException ex = new InvalidEnvelopeException(invalid);
      // 不正な封筒は一時障害ではないので attempt_count=0 のまま隔離する
      final long dlqId =
          deadLetterRepository.insert(
              queueName,
              null,
              truncate(envelope.idempotencyKey(), DEAD_LETTER_KEY_MAX_LENGTH),
              toJson(envelope),
              truncate(ex.getMessage(), properties.errorMessageMaxLength()),
              0,
              null,
              now);
      logger.warn(
          "job envelope rejected queue={} dlqId={} invalidFields={}", queueName, dlqId, invalid);
      throw ex;
    }
    final JobEnvelope normalized = withDefaults(envelope, now);
    final long msgId = messageStore.enqueue(queueName, toJson(normalized), now);
    logger.debug("job enqueued queue={} msgId={} jobId={}", queueName, msgId, normalized.jobId());
    return msgId;
  }

  private JobEnvelope withDefaults(JobEnvelope envelope, Instant now) {
    return new JobEnvelope(
        envelope.jobId() == null || envelope.jobId().isBlank()
            ? UUID.randomUUID().toString()
            : envelope.jobId(),
        TraceIds.orNew(envelope.traceId()),
        envelope.orgId(),
        envelope.idempotencyKey(),
        envelope.entityType(),
        envelope.entityId(),
        envelope.attempt(),
        envelope.createdAt() == null ? now : envelope.createdAt(),
        envelope.payload());
  }

  private void requireQueueName(String queueName) {
    if (queueName == null || queueName.isBlank()) {
      throw new IllegalArgumentException("queue name is required");
    }
  }

  private String toJson(JobEnvelope envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize job envelope", ex);
    }
  }

  private String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
