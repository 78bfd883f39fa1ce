/*
 * どこで: ImportHeartbeat のユニットテスト
 * 何を: heartbeat 拒否時の停止、一時障害時の継続、close 後の再開禁止を検証する
 * なぜ: 奪われた claim を延命し続けないことを保証するため
 */
package com.dragonfly.jobs.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ImportHeartbeatTest {

  private static final UUID RUN_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final String WORKER_ID = "importer-1";

  @Test
  void rejectedBeatMarksClaimLostAndStopsBeating() {
    final AtomicInteger calls = new AtomicInteger();
    final ImportHeartbeat heartbeat =
        new ImportHeartbeat(
            RUN_ID,
            WORKER_ID,
            Duration.ofMinutes(1),
            () -> {
              calls.incrementAndGet();
              return false;
            });

    heartbeat.beatOnce();
    heartbeat.beatOnce();

    assertThat(heartbeat.isClaimLost()).isTrue();
    assertThat(calls).hasValue(1);
  }

  @Test
  void transientFailureKeepsClaim() {
    final AtomicInteger calls = new AtomicInteger();
    final ImportHeartbeat heartbeat =
        new ImportHeartbeat(
            RUN_ID,
            WORKER_ID,
            Duration.ofMinutes(1),
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
              }
              return true;
            });

    heartbeat.beatOnce();
    heartbeat.beatOnce();

    assertThat(heartbeat.isClaimLost()).isFalse();
    assertThat(calls).hasValue(2);
  }

  @Test
  void startedHeartbeatBeatsPeriodically() throws Exception {
    final CountDownLatch beats = new CountDownLatch(3);
    try (ImportHeartbeat heartbeat =
        new ImportHeartbeat(
            RUN_ID,
            WORKER_ID,
            Duration.ofMillis(10),
            () -> {
              beats.countDown();
              return true;
            })) {
      heartbeat.start();

      assertThat(beats.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(heartbeat.isClaimLost()).isFalse();
    }
  }

  @Test
  void closedHeartbeatCannotRestart() {
    final ImportHeartbeat heartbeat =
        new ImportHeartbeat(RUN_ID, WORKER_ID, Duration.ofMillis(10), () -> true);
    heartbeat.start();
    heartbeat.close();
    heartbeat.close();

    assertThatThrownBy(heartbeat::start).isInstanceOf(IllegalStateException.class);
    assertThat(heartbeat.runId()).isEqualTo(RUN_ID);
    assertThat(heartbeat.workerId()).isEqualTo(WORKER_ID);
  }
}
