/*
 * どこで: Jobs サービス層
 * 何を: 1 つの import run の claim を一定間隔で延命するバックグラウンドタスク
 * なぜ: 長時間の取込中に heartbeat 切れで claim を奪われないようにするため
 */
package com.dragonfly.jobs.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * (run_id, worker_id) ごとに専用スレッドで heartbeat を送る。取込処理を try-with-resources で囲み、終了時に必ず close する。
 *
 * <p>heartbeat が拒否された場合(claim が他ワーカーに奪われた場合)はタスクを止め、{@link #isClaimLost()} が true になる。
 */
public final class ImportHeartbeat implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ImportHeartbeat.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final UUID runId;
  private final String workerId;
  private final Duration interval;
  private final BooleanSupplier beat;
  private final AtomicBoolean claimLost = new AtomicBoolean(false);

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private boolean closed;

  ImportHeartbeat(UUID runId, String workerId, Duration interval, BooleanSupplier beat) {
    this.runId = runId;
    this.workerId = workerId;
    this.interval = interval;
    this.beat = beat;
  }

  synchronized void start() {
    if (closed) {
      throw new IllegalStateException("import heartbeat has been closed runId=" + runId);
    }
    if (task != null) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("import-heartbeat-" + runId + "-%d")
                .setDaemon(true)
                .build());
    final long intervalMillis = interval.toMillis();
    task =
        scheduler.scheduleWithFixedDelay(
            this::beatOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
  }

  @VisibleForTesting
  void beatOnce() {
    if (claimLost.get()) {
      return;
    }
    try {
      if (!beat.getAsBoolean()) {
        claimLost.set(true);
        logger.warn("import claim lost; stopping heartbeat runId={} workerId={}", runId, workerId);
        cancelTask();
      }
    } catch (RuntimeException ex) {
      // 一時的な DB 障害では止めず、次の周期で再送する
      logger.warn("import heartbeat failed runId={} workerId={}", runId, workerId, ex);
    }
  }

  public UUID runId() {
    return runId;
  }

  public String workerId() {
    return workerId;
  }

  public boolean isClaimLost() {
    return claimLost.get();
  }

  @Override
  public synchronized void close() {
    closed = true;
    cancelTask();
    task = null;
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  // スケジューラ側のスレッドからも呼ばれるためロックを取らない
  private void cancelTask() {
    final ScheduledFuture<?> current = task;
    if (current != null) {
      current.cancel(false);
    }
  }
}
