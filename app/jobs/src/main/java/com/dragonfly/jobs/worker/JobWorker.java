/*
 * どこで: Jobs ワーカー
 * 何を: poll → 冪等チェック → claim → 処理 → ack の 1 サイクルを実行する
 * なぜ: リトライ上限/DLQ/重複排除をハンドラ共通の 1 か所で扱うため
 */
package com.dragonfly.jobs.worker;

import com.dragonfly.jobs.config.JobWorkerProperties;
import com.dragonfly.jobs.model.JobClaimOutcome;
import com.dragonfly.jobs.model.JobEnvelope;
import com.dragonfly.jobs.model.JobOutcome;
import com.dragonfly.jobs.model.ProcessedJobRecord;
import com.dragonfly.jobs.model.ProcessedJobStatus;
import com.dragonfly.jobs.model.QueueMessage;
import com.dragonfly.jobs.repository.DeadLetterRepository;
import com.dragonfly.jobs.repository.MessageStore;
import com.dragonfly.jobs.service.FollowUpJob;
import com.dragonfly.jobs.service.IdempotencyKeys;
import com.dragonfly.jobs.service.IdempotencyRegistry;
import com.dragonfly.jobs.service.JobContext;
import com.dragonfly.jobs.service.JobHandler;
import com.dragonfly.jobs.service.JobMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class JobWorker {

  private static final Logger logger = LoggerFactory.getLogger(JobWorker.class);
  private static final String MDC_QUEUE = "queue";
  private static final String MDC_MSG_ID = "msg_id";
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_TRACE_ID = "trace_id";

  private final MessageStore messageStore;
  private final IdempotencyRegistry idempotencyRegistry;
  private final IdempotencyKeys idempotencyKeys;
  private final DeadLetterRepository deadLetterRepository;
  private final JobMetrics metrics;
  private final JobWorkerProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /** 1 バッチ分を読み出して処理する。空のリストはキューが空だったことを表す。 */
  public List<JobOutcome> pollOnce(JobHandler handler, String workerId) {
    final String queueName = handler.queueName();
    // リース取得は単一 SQL で行い、ハンドラの IO を長いトランザクションに載せない
    final List<QueueMessage> messages =
        messageStore.read(
            queueName, properties.batchSize(), properties.visibilityTimeout(), Instant.now(clock));
    final List<JobOutcome> outcomes = new ArrayList<>(messages.size());
    for (QueueMessage message : messages) {
      final JobOutcome outcome = handleMessage(handler, message, workerId);
      metrics.recordJobOutcome(queueName, outcome);
      outcomes.add(outcome);
    }
    return outcomes;
  }

  private JobOutcome handleMessage(JobHandler handler, QueueMessage message, String workerId) {
    MDC.put(MDC_QUEUE, message.queueName());
    MDC.put(MDC_MSG_ID, String.valueOf(message.msgId()));
    try {
      // バッチ内の後続メッセージは前のメッセージの処理時間だけ遅れて始まる
      final Instant now = Instant.now(clock);
      if (!message.visibilityDeadline().isAfter(now)) {
        // リースが切れたメッセージは別ワーカーが読み直している可能性があるので触らない
        logger.warn(
            "job skipped because lease expired before processing queue={} msgId={} deadline={}",
            message.queueName(),
            message.msgId(),
            message.visibilityDeadline());
        return JobOutcome.LOCK_LOST;
      }
      return dispatch(handler, message, workerId, now);
    } catch (RuntimeException ex) {
      // 基盤側の失敗はハンドラの失敗として数えず、リース切れ後の再配信に任せる
      logger.warn(
          "job handling aborted; message will be redelivered queue={} msgId={}",
          message.queueName(),
          message.msgId(),
          ex);
      return JobOutcome.FAILED;
    } finally {
      MDC.remove(MDC_QUEUE);
      MDC.remove(MDC_MSG_ID);
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_TRACE_ID);
    }
  }

  private JobOutcome dispatch(
      JobHandler handler, QueueMessage message, String workerId, Instant now) {
    if (message.readCount() > properties.maxRetries()) {
      // 処理結果に関係なく、読み出し回数が上限を超えたメッセージは隔離する
      final String error =
          "poison message: read_count="
              + message.readCount()
              + " exceeds max_retries="
              + properties.maxRetries();
      return quarantine(message, null, error, message.readCount() - 1, workerId, now)
          ? JobOutcome.POISON
          : JobOutcome.LOCK_LOST;
    }

    final JobEnvelope envelope;
    try {
      envelope = objectMapper.readValue(message.payloadJson(), JobEnvelope.class);
    } catch (JsonProcessingException ex) {
      final String error = "invalid envelope: " + ex.getOriginalMessage();
      return quarantine(message, null, error, 0, workerId, now)
          ? JobOutcome.INVALID
          : JobOutcome.LOCK_LOST;
    }
    final List<String> invalidFields = envelope.invalidFields();
    if (!invalidFields.isEmpty()) {
      final String error = "invalid envelope: missing " + String.join(", ", invalidFields);
      return quarantine(message, null, error, 0, workerId, now)
          ? JobOutcome.INVALID
          : JobOutcome.LOCK_LOST;
    }
    putIfPresent(MDC_JOB_ID, envelope.jobId());
    putIfPresent(MDC_TRACE_ID, envelope.traceId());

    final String queueName = message.queueName();
    final String key =
        handler
            .idempotencyKey(envelope)
            .orElseGet(() -> idempotencyKeys.derive(queueName, message.payloadJson()));

    final Optional<ProcessedJobRecord> existing = idempotencyRegistry.find(key);
    if (existing.isPresent() && existing.get().status() == ProcessedJobStatus.COMPLETED) {
      acknowledgeDuplicate(message, key, now);
      return JobOutcome.DUPLICATE;
    }

    final JobClaimOutcome claim =
        idempotencyRegistry.claim(
            key,
            queueName,
            message.msgId(),
            workerId,
            now,
            now.minus(properties.visibilityTimeout()));
    if (!claim.inserted()) {
      return handleExistingClaim(message, key, claim.record(), now);
    }
    return process(handler, message, envelope, key, workerId, now);
  }

  private JobOutcome handleExistingClaim(
      QueueMessage message, String key, ProcessedJobRecord existing, Instant now) {
    if (existing.status() == ProcessedJobStatus.COMPLETED) {
      acknowledgeDuplicate(message, key, now);
      return JobOutcome.DUPLICATE;
    }
    if (existing.status() == ProcessedJobStatus.PROCESSING && !existing.ownedBy(message.msgId())) {
      // 同じ論理ジョブを別メッセージが処理中。こちらは重複として ack する
      acknowledgeDuplicate(message, key, now);
      return JobOutcome.DUPLICATE;
    }
    // 自分のメッセージの前回リースがまだ claim を保持している。stale になるまで待つ
    logger.info(
        "job claim still held; waiting for lease expiry key={} msgId={} status={} worker={}",
        key,
        message.msgId(),
        existing.status(),
        existing.workerId());
    return JobOutcome.DEFERRED;
  }

  private JobOutcome process(
      JobHandler handler,
      QueueMessage message,
      JobEnvelope envelope,
      String key,
      String workerId,
      Instant now) {
    final JobContext context =
        new JobContext(envelope, message.msgId(), message.readCount(), workerId, now);
    final long startedAt = System.nanoTime();
    final JsonNode result;
    try {
      result = handler.process(envelope, context);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.recordLatency(message.queueName(), Duration.ofNanos(System.nanoTime() - startedAt));
      return handleFailure(message, key, ex, workerId, Instant.now(clock));
    } catch (Exception ex) {
      metrics.recordLatency(message.queueName(), Duration.ofNanos(System.nanoTime() - startedAt));
      return handleFailure(message, key, ex, workerId, Instant.now(clock));
    }
    metrics.recordLatency(message.queueName(), Duration.ofNanos(System.nanoTime() - startedAt));
    return completeAndAcknowledge(message, key, result, context, workerId, Instant.now(clock));
  }

  private JobOutcome completeAndAcknowledge(
      QueueMessage message,
      String key,
      JsonNode result,
      JobContext context,
      String workerId,
      Instant now) {
    final String resultJson = result == null || result.isNull() ? null : toJson(result);
    final List<FollowUpJob> followUps = context.followUps();
    final List<String> followUpPayloads = new ArrayList<>(followUps.size());
    for (FollowUpJob followUp : followUps) {
      followUpPayloads.add(toJson(followUp.envelope()));
    }
    // 完了記録・後続 enqueue・ack を 1 トランザクションにまとめ、途中で落ちても二重実行にならないようにする
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Acknowledgement acknowledgement =
        transactionTemplate.execute(
            status -> {
              if (!idempotencyRegistry.complete(key, message.msgId(), workerId, resultJson, now)) {
                status.setRollbackOnly();
                return Acknowledgement.CLAIM_LOST;
              }
              for (int i = 0; i < followUps.size(); i++) {
                messageStore.enqueue(followUps.get(i).queueName(), followUpPayloads.get(i), now);
              }
              // メッセージが既に消えていても完了記録は残す
              return messageStore.archive(message.queueName(), message.msgId(), now)
                  ? Acknowledgement.ARCHIVED
                  : Acknowledgement.MESSAGE_GONE;
            });
    if (acknowledgement == null || acknowledgement == Acknowledgement.CLAIM_LOST) {
      logger.warn(
          "job processed but idempotency claim was lost key={} msgId={}", key, message.msgId());
      return JobOutcome.LOCK_LOST;
    }
    if (acknowledgement == Acknowledgement.MESSAGE_GONE) {
      logger.warn(
          "job completed but message was already removed from queue key={} msgId={}",
          key,
          message.msgId());
      return JobOutcome.LOCK_LOST;
    }
    logger.info(
        "job completed queue={} msgId={} key={} followUps={}",
        message.queueName(),
        message.msgId(),
        key,
        followUps.size());
    return JobOutcome.COMPLETED;
  }

  @VisibleForTesting
  JobOutcome handleFailure(
      QueueMessage message, String key, Exception ex, String workerId, Instant now) {
    final String error = truncateError(describe(ex));
    final OptionalInt attempts =
        idempotencyRegistry.fail(key, message.msgId(), workerId, error, now);
    if (attempts.isEmpty()) {
      logger.warn(
          "job failure not recorded because claim was lost key={} msgId={}",
          key,
          message.msgId(),
          ex);
      return JobOutcome.LOCK_LOST;
    }
    final int attemptCount = Math.max(attempts.getAsInt(), message.readCount());
    if (attemptCount >= properties.maxRetries()) {
      final boolean moved = quarantine(message, key, error, attemptCount, workerId, now);
      if (!moved) {
        logger.warn(
            "job dead letter skipped because message was already acknowledged key={} msgId={}",
            key,
            message.msgId());
        return JobOutcome.LOCK_LOST;
      }
      logger.warn(
          "job moved to dead letter queue={} msgId={} attempts={}",
          message.queueName(),
          message.msgId(),
          attemptCount,
          ex);
      return JobOutcome.DEAD_LETTERED;
    }
    logger.warn(
        "job failed; redelivery after lease expiry queue={} msgId={} attempt={}/{}",
        message.queueName(),
        message.msgId(),
        attemptCount,
        properties.maxRetries(),
        ex);
    return JobOutcome.FAILED;
  }

  private boolean quarantine(
      QueueMessage message,
      String key,
      String error,
      int attemptCount,
      String workerId,
      Instant now) {
    // dead letter 登録とキューからの除去を同一トランザクションにまとめ、二重隔離を避ける
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean moved =
        transactionTemplate.execute(
            status -> {
              deadLetterRepository.insert(
                  message.queueName(),
                  message.msgId(),
                  key,
                  message.payloadJson(),
                  truncateError(error),
                  attemptCount,
                  workerId,
                  now);
              if (!messageStore.delete(message.queueName(), message.msgId())) {
                status.setRollbackOnly();
                return false;
              }
              return true;
            });
    final boolean result = Boolean.TRUE.equals(moved);
    if (result) {
      metrics.recordDeadLettered(message.queueName());
      if (key == null) {
        logger.warn(
            "job quarantined queue={} msgId={} reason={}",
            message.queueName(),
            message.msgId(),
            error);
      }
    }
    return result;
  }

  private void acknowledgeDuplicate(QueueMessage message, String key, Instant now) {
    messageStore.archive(message.queueName(), message.msgId(), now);
    logger.info("duplicate job acknowledged key={} msgId={}", key, message.msgId());
  }

  private String describe(Exception ex) {
    final String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getName();
    }
    return message;
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize job data", ex);
    }
  }

  private void putIfPresent(String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }

  private enum Acknowledgement {
    ARCHIVED,
    MESSAGE_GONE,
    CLAIM_LOST
  }
}
