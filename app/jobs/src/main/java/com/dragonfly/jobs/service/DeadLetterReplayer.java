/*
 * どこで: Jobs サービス層
 * 何を: dead letter の一覧と運用者指示による再投入を行う
 * なぜ: 根本原因の修正後に隔離ジョブを元のキューへ戻せるようにするため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.DeadLetterEntry;
import com.dragonfly.jobs.model.ReplayResult;
import com.dragonfly.jobs.repository.DeadLetterRepository;
import com.dragonfly.jobs.repository.MessageStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DeadLetterReplayer {

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterReplayer.class);

  private final DeadLetterRepository deadLetterRepository;
  private final MessageStore messageStore;
  private final Clock clock;

  /** 参照のみ。queueName が空なら全キューを返す。 */
  public List<DeadLetterEntry> list(String queueName, int limit) {
    if (queueName == null || queueName.isBlank()) {
      return deadLetterRepository.findAll(limit);
    }
    return deadLetterRepository.findByQueue(queueName, limit);
  }

  public Optional<DeadLetterEntry> find(long dlqId) {
    return deadLetterRepository.findById(dlqId);
  }

  @Transactional
  public ReplayResult replay(long dlqId) {
    final DeadLetterEntry entry =
        deadLetterRepository
            .findByIdForUpdate(dlqId)
            .orElseThrow(() -> new DeadLetterNotFoundException(dlqId));
    // 再投入と削除を同一トランザクションにして、二重投入と取りこぼしを避ける
    final long newMsgId =
        messageStore.enqueue(entry.originalQueue(), entry.payloadJson(), Instant.now(clock));
    deadLetterRepository.delete(dlqId);
    logger.info(
        "dead letter replayed dlqId={} queue={} originalJobId={} newMsgId={}",
        dlqId,
        entry.originalQueue(),
        entry.originalJobId(),
        newMsgId);
    return new ReplayResult(dlqId, entry.originalQueue(), newMsgId);
  }
}
