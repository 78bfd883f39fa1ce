/*
 * どこで: Jobs ワーカー
 * 何を: stale な import claim の検出を定期実行する
 * なぜ: 停止した取込ワーカーを運用者が早く気付けるようにするため
 */
package com.dragonfly.jobs.worker;

import com.dragonfly.jobs.service.StaleClaimMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "jobs.import.stale-scan-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StaleClaimMonitorWorker {

  private final StaleClaimMonitor monitor;

  @Scheduled(fixedDelayString = "${jobs.import.stale-scan-interval}")
  public void run() {
    monitor.scan();
  }
}
