/*
 * Where: Jobs service layer
 * What: Applies retention policy to archived messages, completed jobs and stopped workers
 * Why: Prevent unbounded growth while keeping unfinished jobs for investigation
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.config.JobRetentionProperties;
import com.dragonfly.jobs.repository.MessageStore;
import com.dragonfly.jobs.repository.ProcessedJobRepository;
import com.dragonfly.jobs.repository.WorkerHeartbeatRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(JobRetentionService.class);

  private final MessageStore messageStore;
  private final ProcessedJobRepository processedJobRepository;
  private final WorkerHeartbeatRepository workerHeartbeatRepository;
  private final JobRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int unfinishedCount = processedJobRepository.countUnfinishedOlderThan(threshold);
    if (unfinishedCount > 0) {
      logger.error(
          "job retention found unfinished processed jobs count={} threshold={}",
          unfinishedCount,
          threshold);
    }
    final int deletedArchived = messageStore.deleteArchivedOlderThan(threshold);
    final int deletedProcessed = processedJobRepository.deleteCompletedOlderThan(threshold);
    final int deletedWorkers = workerHeartbeatRepository.deleteStoppedOlderThan(threshold);
    logger.info(
        "job retention cleanup deleted archivedMessages={} processedJobs={} workers={} threshold={}",
        deletedArchived,
        deletedProcessed,
        deletedWorkers,
        threshold);
  }
}
