/*
 * どこで: Jobs ワーカー
 * 何を: 登録された JobHandler ごとにポーリングスレッドを起動/停止する
 * なぜ: キューごとの並列度と graceful shutdown をアプリのライフサイクルに合わせるため
 */
package com.dragonfly.jobs.worker;

import com.dragonfly.jobs.config.JobWorkerProperties;
import com.dragonfly.jobs.model.JobOutcome;
import com.dragonfly.jobs.model.WorkerStatus;
import com.dragonfly.jobs.repository.WorkerHeartbeatRepository;
import com.dragonfly.jobs.service.JobHandler;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "jobs.worker.enabled", havingValue = "true", matchIfMissing = true)
public class JobWorkerRunner implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(JobWorkerRunner.class);

  private final JobWorker jobWorker;
  private final ObjectProvider<JobHandler> handlers;
  private final WorkerHeartbeatRepository heartbeatRepository;
  private final JobWorkerProperties properties;
  private final Clock clock;
  private final String hostname;
  private final String instanceId;

  private ExecutorService executor;
  private final List<WorkerLoop> loops = new ArrayList<>();
  private volatile boolean running;

  public JobWorkerRunner(
      JobWorker jobWorker,
      ObjectProvider<JobHandler> handlers,
      WorkerHeartbeatRepository heartbeatRepository,
      JobWorkerProperties properties,
      Clock clock) {
    this.jobWorker = jobWorker;
    this.handlers = handlers;
    this.heartbeatRepository = heartbeatRepository;
    this.properties = properties;
    this.clock = clock;
    this.hostname = resolveHostname();
    this.instanceId = UUID.randomUUID().toString().substring(0, 8);
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    final List<JobHandler> registered = handlers.orderedStream().collect(Collectors.toList());
    if (registered.isEmpty()) {
      logger.info("job worker has no handlers registered; nothing to poll");
      running = true;
      return;
    }
    running = true;
    final int threads = registered.size() * properties.concurrency();
    executor =
        Executors.newFixedThreadPool(
            threads, new ThreadFactoryBuilder().setNameFormat("job-worker-%d").build());
    for (JobHandler handler : registered) {
      for (int index = 0; index < properties.concurrency(); index++) {
        final WorkerLoop loop = new WorkerLoop(handler, workerId(handler.queueName(), index));
        loops.add(loop);
        executor.execute(loop);
      }
    }
    logger.info(
        "job worker started host={} queues={} concurrency={} batchSize={} visibilityTimeout={} maxRetries={}",
        hostname,
        registered.stream().map(JobHandler::queueName).collect(Collectors.toList()),
        properties.concurrency(),
        properties.batchSize(),
        properties.visibilityTimeout(),
        properties.maxRetries());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (executor == null) {
      return;
    }
    // 処理中のバッチは最後まで進めさせ、タイムアウト後に割り込む
    executor.shutdown();
    try {
      if (!executor.awaitTermination(
          properties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn(
            "job worker did not stop within {}; interrupting", properties.shutdownTimeout());
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    for (WorkerLoop loop : loops) {
      loop.reportStopped();
    }
    logger.info("job worker stopped workers={}", loops.size());
    loops.clear();
    executor = null;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @VisibleForTesting
  String workerId(String queueName, int index) {
    return hostname + "-" + instanceId + "-" + queueName + "-" + index;
  }

  private static String resolveHostname() {
    final String env = System.getenv("HOSTNAME");
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      logger.warn("hostname could not be resolved; using placeholder", ex);
      return "unknown-host";
    }
  }

  private final class WorkerLoop implements Runnable {

    private final JobHandler handler;
    private final String workerId;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private Instant lastReportedAt;

    private WorkerLoop(JobHandler handler, String workerId) {
      this.handler = handler;
      this.workerId = workerId;
    }

    @Override
    public void run() {
      report(WorkerStatus.STARTING);
      logger.info("job worker loop started workerId={} queue={}", workerId, handler.queueName());
      while (running && !Thread.currentThread().isInterrupted()) {
        final List<JobOutcome> outcomes;
        try {
          outcomes = jobWorker.pollOnce(handler, workerId);
        } catch (RuntimeException ex) {
          // DB 障害などでループを落とさない。次のポーリングで再試行する
          logger.error("job poll failed workerId={} queue={}", workerId, handler.queueName(), ex);
          if (!sleep()) {
            break;
          }
          continue;
        }
        for (JobOutcome outcome : outcomes) {
          if (outcome.isFailure()) {
            failed.incrementAndGet();
          } else if (outcome == JobOutcome.COMPLETED) {
            processed.incrementAndGet();
          }
        }
        reportIfDue();
        if (outcomes.isEmpty() && !sleep()) {
          break;
        }
      }
      logger.info("job worker loop exited workerId={}", workerId);
    }

    private boolean sleep() {
      try {
        Thread.sleep(properties.pollInterval().toMillis());
        return true;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return false;
      }
    }

    private void reportIfDue() {
      final Instant now = Instant.now(clock);
      if (lastReportedAt == null
          || !now.isBefore(lastReportedAt.plus(properties.livenessInterval()))) {
        report(WorkerStatus.HEALTHY);
      }
    }

    private void reportStopped() {
      report(WorkerStatus.STOPPED);
    }

    private void report(WorkerStatus status) {
      final Instant now = Instant.now(clock);
      try {
        heartbeatRepository.upsert(
            workerId,
            handler.queueName(),
            hostname,
            status,
            processed.get(),
            failed.get(),
            now);
        lastReportedAt = now;
      } catch (RuntimeException ex) {
        logger.warn("worker heartbeat update failed workerId={} status={}", workerId, status, ex);
      }
    }
  }
}
