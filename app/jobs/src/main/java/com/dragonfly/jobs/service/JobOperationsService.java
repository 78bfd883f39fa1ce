/*
 * どこで: Jobs サービス層
 * 何を: キュー滞留/ワーカー稼働状況の参照系をまとめる
 * なぜ: 運用 API から DB 直接参照せずに同じ集計を使うため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.QueueMetrics;
import com.dragonfly.jobs.model.WorkerHeartbeatRecord;
import com.dragonfly.jobs.repository.MessageStore;
import com.dragonfly.jobs.repository.WorkerHeartbeatRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobOperationsService {

  private final MessageStore messageStore;
  private final WorkerHeartbeatRepository workerHeartbeatRepository;
  private final Clock clock;

  public List<QueueMetrics> queueOverview() {
    final Instant now = Instant.now(clock);
    final List<QueueMetrics> result = new ArrayList<>();
    for (String queueName : messageStore.listQueues()) {
      result.add(messageStore.metrics(queueName, now));
    }
    return result;
  }

  public QueueMetrics queueMetrics(String queueName) {
    return messageStore.metrics(queueName, Instant.now(clock));
  }

  public List<WorkerHeartbeatRecord> workers() {
    return workerHeartbeatRepository.findAll();
  }
}
