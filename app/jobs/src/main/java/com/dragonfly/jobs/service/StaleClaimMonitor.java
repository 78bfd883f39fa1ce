/*
 * どこで: Jobs サービス層
 * 何を: heartbeat が途絶えた import claim を検出して記録する
 * なぜ: 取込ワーカーの停止を運用者に知らせるため。奪い直しは次の claim() が判定する
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.config.ImportClaimProperties;
import com.dragonfly.jobs.model.ImportRunRecord;
import com.dragonfly.jobs.repository.ImportRunRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StaleClaimMonitor {

  private static final Logger logger = LoggerFactory.getLogger(StaleClaimMonitor.class);

  private final ImportRunRepository importRunRepository;
  private final ImportClaimProperties properties;
  private final JobMetrics metrics;
  private final Clock clock;

  /** stale な claim を返す。ステータスは変更しない。 */
  public List<ImportRunRecord> scan() {
    final Instant now = Instant.now(clock);
    final Instant staleBefore = now.minus(properties.stalenessWindow());
    final int staleCount = importRunRepository.countStale(staleBefore);
    metrics.updateStaleClaims(staleCount);
    if (staleCount == 0) {
      return List.of();
    }
    final List<ImportRunRecord> stale =
        importRunRepository.findStale(staleBefore, properties.staleScanLimit());
    for (ImportRunRecord run : stale) {
      logger.warn(
          "stale import claim runId={} sourceSystem={} batchId={} workerId={} silentFor={}",
          run.runId(),
          run.sourceSystem(),
          run.sourceBatchId(),
          run.workerId(),
          Duration.between(run.heartbeatAt(), now));
    }
    logger.warn(
        "stale import claims detected count={} staleBefore={} (eligible for takeover on next claim)",
        staleCount,
        staleBefore);
    return stale;
  }
}
