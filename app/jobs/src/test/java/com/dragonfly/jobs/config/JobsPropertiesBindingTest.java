/*
 * どこで: Jobs 設定バインドのテスト
 * 何を: Duration 表記と既定の接頭辞で各 properties がバインドされることを検証する
 * なぜ: 設定キーの変更が起動時に正しく解釈されることを保証するため
 */
package com.dragonfly.jobs.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class JobsPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "jobs.worker.enabled=true",
              "jobs.worker.batch-size=20",
              "jobs.worker.visibility-timeout=45s",
              "jobs.worker.poll-interval=500ms",
              "jobs.worker.max-retries=5",
              "jobs.worker.concurrency=2",
              "jobs.worker.idempotency-hash-algorithm=SHA-512",
              "jobs.worker.error-message-max-length=2000",
              "jobs.worker.liveness-interval=15s",
              "jobs.worker.shutdown-timeout=30s",
              "jobs.import.staleness-window=30m",
              "jobs.import.heartbeat-interval=1m",
              "jobs.import.claim-max-retries=3",
              "jobs.import.stale-scan-enabled=true",
              "jobs.import.stale-scan-interval=5m",
              "jobs.import.stale-scan-limit=100",
              "jobs.retention.enabled=true",
              "jobs.retention.retention-days=30",
              "jobs.retention.cleanup-interval=1h");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final JobWorkerProperties worker = context.getBean(JobWorkerProperties.class);
          final ImportClaimProperties claim = context.getBean(ImportClaimProperties.class);
          final JobRetentionProperties retention = context.getBean(JobRetentionProperties.class);

          assertThat(worker.visibilityTimeout()).isEqualTo(Duration.ofSeconds(45));
          assertThat(worker.pollInterval()).isEqualTo(Duration.ofMillis(500));
          assertThat(worker.idempotencyHashAlgorithm()).isEqualTo("SHA-512");
          assertThat(claim.stalenessWindow()).isEqualTo(Duration.ofMinutes(30));
          assertThat(claim.heartbeatInterval()).isEqualTo(Duration.ofMinutes(1));
          assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(1));
        });
  }

  @Test
  void contextFailsWhenHeartbeatOutlivesStalenessWindow() {
    contextRunner
        .withPropertyValues("jobs.import.heartbeat-interval=45m")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    JobWorkerProperties.class,
    ImportClaimProperties.class,
    JobRetentionProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
