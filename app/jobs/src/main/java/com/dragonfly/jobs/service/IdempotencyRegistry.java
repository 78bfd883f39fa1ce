/*
 * どこで: Jobs サービス層
 * 何を: 冪等キーの claim/complete/fail ライフサイクルを提供する
 * なぜ: ワーカーが副作用を高々 1 回だけ実行できるようにするため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.JobClaimOutcome;
import com.dragonfly.jobs.model.ProcessedJobRecord;
import com.dragonfly.jobs.repository.ProcessedJobRepository;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdempotencyRegistry {

  // 既存行が retention で消えた直後に当たった場合だけ再試行する
  private static final int CLAIM_ATTEMPTS = 3;

  private final ProcessedJobRepository processedJobRepository;

  /**
   * キーを claim する。
   *
   * @param staleBefore これより前から PROCESSING のままの行は持ち主が落ちたとみなして奪い直す
   */
  public JobClaimOutcome claim(
      String idempotencyKey,
      String queueName,
      long msgId,
      String workerId,
      Instant now,
      Instant staleBefore) {
    for (int attempt = 0; attempt < CLAIM_ATTEMPTS; attempt++) {
      final Optional<ProcessedJobRecord> inserted =
          processedJobRepository.claim(idempotencyKey, queueName, msgId, workerId, now, staleBefore);
      if (inserted.isPresent()) {
        return JobClaimOutcome.inserted(inserted.get());
      }
      final Optional<ProcessedJobRecord> existing = processedJobRepository.findByKey(idempotencyKey);
      if (existing.isPresent()) {
        return JobClaimOutcome.alreadyExists(existing.get());
      }
    }
    throw new IllegalStateException("idempotency claim did not converge key=" + idempotencyKey);
  }

  public Optional<ProcessedJobRecord> find(String idempotencyKey) {
    return processedJobRepository.findByKey(idempotencyKey);
  }

  /** @return claim を保持したまま完了できた場合 true */
  public boolean complete(
      String idempotencyKey, long msgId, String workerId, String resultJson, Instant now) {
    return processedJobRepository.markCompleted(idempotencyKey, msgId, workerId, resultJson, now)
        > 0;
  }

  /** @return 更新後の attempts。claim を失っていた場合は空 */
  public OptionalInt fail(
      String idempotencyKey, long msgId, String workerId, String error, Instant now) {
    return processedJobRepository.markFailed(idempotencyKey, msgId, workerId, error, now);
  }
}
