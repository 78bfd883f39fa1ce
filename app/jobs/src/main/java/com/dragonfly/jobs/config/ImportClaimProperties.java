/*
 * どこで: Jobs アプリの設定バインド
 * 何を: バッチ claim の stale 判定と heartbeat 間隔を保持する
 * なぜ: 取込ジョブの長さに合わせて閾値を環境ごとに調整するため
 */
package com.dragonfly.jobs.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobs.import")
public record ImportClaimProperties(
    Duration stalenessWindow,
    Duration heartbeatInterval,
    @Positive int claimMaxRetries,
    boolean staleScanEnabled,
    Duration staleScanInterval,
    @Positive int staleScanLimit) {

  @AssertTrue(message = "jobs.import.staleness-window must be positive")
  public boolean isStalenessWindowPositive() {
    return isPositiveDuration(stalenessWindow);
  }

  @AssertTrue(message = "jobs.import.heartbeat-interval must be shorter than jobs.import.staleness-window")
  public boolean isHeartbeatIntervalShorterThanStalenessWindow() {
    // heartbeat が間に合わないと生きている claim が奪われる
    return isPositiveDuration(heartbeatInterval)
        && stalenessWindow != null
        && heartbeatInterval.compareTo(stalenessWindow) < 0;
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
