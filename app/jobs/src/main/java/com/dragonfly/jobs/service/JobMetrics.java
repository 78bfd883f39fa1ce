/*
 * どこで: Jobs サービス層
 * 何を: ジョブ処理結果/DLQ 移送/処理時間/バッチ claim/stale claim のメトリクスを記録する
 * なぜ: キューとバッチ取込の健全性を Prometheus から直接観測できるようにするため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.ClaimStatus;
import com.dragonfly.jobs.model.JobOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JobMetrics {

  private static final String METRIC_PROCESSED_TOTAL = "jobs.processed.total";
  private static final String METRIC_DLQ_TOTAL = "jobs.dlq.total";
  private static final String METRIC_LATENCY = "jobs.latency";
  private static final String METRIC_IMPORT_CLAIM_TOTAL = "import.claim.total";
  private static final String METRIC_IMPORT_STALE_CURRENT = "import.stale.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger staleClaimsCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> processedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dlqCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<ClaimStatus, Counter> claimCounters = new ConcurrentHashMap<>();

  public JobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_IMPORT_STALE_CURRENT, staleClaimsCurrent, AtomicInteger::get)
        .description("Current number of import runs whose heartbeat is older than the staleness window")
        .register(meterRegistry);
  }

  public void recordJobOutcome(String queueName, JobOutcome outcome) {
    processedCounters
        .computeIfAbsent(
            queueName + "|" + outcome.tag(),
            ignored ->
                Counter.builder(METRIC_PROCESSED_TOTAL)
                    .description("Job processing outcomes")
                    .tags(Tags.of("queue", queueName, "result", outcome.tag()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeadLettered(String queueName) {
    dlqCounters
        .computeIfAbsent(
            queueName,
            ignored ->
                Counter.builder(METRIC_DLQ_TOTAL)
                    .description("Total number of jobs moved to the dead letter store")
                    .tags(Tags.of("queue", queueName))
                    .register(meterRegistry))
        .increment();
  }

  public void recordLatency(String queueName, Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    latencyTimers
        .computeIfAbsent(
            queueName,
            ignored ->
                Timer.builder(METRIC_LATENCY)
                    .description("Handler processing time per job")
                    .tags(Tags.of("queue", queueName))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordImportClaim(ClaimStatus status) {
    claimCounters
        .computeIfAbsent(
            status,
            ignored ->
                Counter.builder(METRIC_IMPORT_CLAIM_TOTAL)
                    .description("Import run claim outcomes")
                    .tags(Tags.of("status", status.name().toLowerCase(Locale.ROOT)))
                    .register(meterRegistry))
        .increment();
  }

  public void updateStaleClaims(int count) {
    staleClaimsCurrent.set(Math.max(count, 0));
  }
}
