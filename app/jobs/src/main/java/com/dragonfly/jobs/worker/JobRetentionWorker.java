/*
 * Where: Jobs cleanup worker
 * What: Triggers retention cleanup on a schedule
 * Why: Keep archive and processed_jobs tables bounded without manual work
 */
package com.dragonfly.jobs.worker;

import com.dragonfly.jobs.service.JobRetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "jobs.retention.enabled", havingValue = "true")
public class JobRetentionWorker {

  private final JobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${jobs.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
