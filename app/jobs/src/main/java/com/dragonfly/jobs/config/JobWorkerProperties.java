/*
 * どこで: Jobs アプリの設定バインド
 * 何を: ワーカーのポーリング/リース/リトライ設定を保持する
 * なぜ: キューごとの運用パラメータを外部化するため
 */
package com.dragonfly.jobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobs.worker")
public record JobWorkerProperties(
    boolean enabled,
    @Positive int batchSize,
    Duration visibilityTimeout,
    Duration pollInterval,
    @Positive int maxRetries,
    @Positive int concurrency,
    @NotBlank String idempotencyHashAlgorithm,
    @Positive int errorMessageMaxLength,
    Duration livenessInterval,
    Duration shutdownTimeout) {

  @AssertTrue(message = "jobs.worker.visibility-timeout must be positive")
  public boolean isVisibilityTimeoutPositive() {
    return isPositiveDuration(visibilityTimeout);
  }

  @AssertTrue(message = "jobs.worker.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(message = "jobs.worker.liveness-interval must be positive")
  public boolean isLivenessIntervalPositive() {
    return isPositiveDuration(livenessInterval);
  }

  @AssertTrue(message = "jobs.worker.shutdown-timeout must be positive")
  public boolean isShutdownTimeoutPositive() {
    return isPositiveDuration(shutdownTimeout);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
