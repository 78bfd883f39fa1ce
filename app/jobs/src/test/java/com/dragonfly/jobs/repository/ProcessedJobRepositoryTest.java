/*
 * どこで: ProcessedJobRepository の統合テスト
 * 何を: claim の一意性/FAILED と stale の奪い直し/所有者照合付きの完了・失敗を検証する
 * なぜ: 冪等キーの一意制約だけで二重実行を防げることを DB 上で保証するため
 */
package com.dragonfly.jobs.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.dragonfly.jobs.AbstractPostgresContainerTest;
import com.dragonfly.jobs.TestTables;
import com.dragonfly.jobs.model.ProcessedJobRecord;
import com.dragonfly.jobs.model.ProcessedJobStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ProcessedJobRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");
    private static final Duration STALE_AFTER = Duration.ofSeconds(30);
    private static final String KEY = "enrich:hash:abc";
    private static final String QUEUE = "enrich";

    @Autowired
    private ProcessedJobRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        TestTables.truncateAll(jdbcTemplate);
    }

    @Test
    void secondClaimForSameKeyReturnsEmpty() {
        Optional<ProcessedJobRecord> first =
                repository.claim(KEY, QUEUE, 1L, "worker-a", BASE_TIME, BASE_TIME.minus(STALE_AFTER));
        Optional<ProcessedJobRecord> second =
                repository.claim(KEY, QUEUE, 2L, "worker-b", BASE_TIME, BASE_TIME.minus(STALE_AFTER));

        assertThat(first).isPresent();
        assertThat(first.get().status()).isEqualTo(ProcessedJobStatus.PROCESSING);
        assertThat(first.get().attempts()).isZero();
        assertThat(second).isEmpty();
        assertThat(TestTables.count(jdbcTemplate, "processed_jobs")).isEqualTo(1);
        // 既存行の持ち主は最初の claim のまま
        assertThat(repository.findByKey(KEY).orElseThrow().workerId()).isEqualTo("worker-a");
    }

    @Test
    void failedClaimIsReclaimedWithAttemptsPreserved() {
        repository.claim(KEY, QUEUE, 1L, "worker-a", BASE_TIME, BASE_TIME.minus(STALE_AFTER));
        OptionalInt attempts = repository.markFailed(KEY, 1L, "worker-a", "boom", BASE_TIME);

        Instant later = BASE_TIME.plusSeconds(40);
        Optional<ProcessedJobRecord> reclaimed =
                repository.claim(KEY, QUEUE, 1L, "worker-b", later, later.minus(STALE_AFTER));

        assertThat(attempts).hasValue(1);
        assertThat(reclaimed).isPresent();
        assertThat(reclaimed.get().status()).isEqualTo(ProcessedJobStatus.PROCESSING);
        assertThat(reclaimed.get().attempts()).isEqualTo(1);
        assertThat(reclaimed.get().workerId()).isEqualTo("worker-b");
    }

    @Test
    void staleProcessingClaimIsReclaimedButFreshOneIsNot() {
        repository.claim(KEY, QUEUE, 1L, "worker-a", BASE_TIME, BASE_TIME.minus(STALE_AFTER));

        Instant fresh = BASE_TIME.plusSeconds(10);
        Instant stale = BASE_TIME.plusSeconds(31);

        assertThat(repository.claim(KEY, QUEUE, 1L, "worker-b", fresh, fresh.minus(STALE_AFTER)))
                .isEmpty();
        assertThat(repository.claim(KEY, QUEUE, 1L, "worker-b", stale, stale.minus(STALE_AFTER)))
                .isPresent();
    }

    @Test
    void completedClaimIsNeverReclaimed() {
        repository.claim(KEY, QUEUE, 1L, "worker-a", BASE_TIME, BASE_TIME.minus(STALE_AFTER));
        repository.markCompleted(KEY, 1L, "worker-a", "{\"ok\":true}", BASE_TIME);

        Instant muchLater = BASE_TIME.plus(Duration.ofDays(1));
        Optional<ProcessedJobRecord> again =
                repository.claim(KEY, QUEUE, 2L, "worker-b", muchLater, muchLater.minus(STALE_AFTER));

        assertThat(again).isEmpty();
        ProcessedJobRecord record = repository.findByKey(KEY).orElseThrow();
        assertThat(record.status()).isEqualTo(ProcessedJobStatus.COMPLETED);
        assertThat(record.resultJson()).isEqualTo("{\"ok\": true}");
    }

    @Test
    void completeAndFailRequireCurrentOwner() {
        repository.claim(KEY, QUEUE, 1L, "worker-a", BASE_TIME, BASE_TIME.minus(STALE_AFTER));

        // 別ワーカー/別メッセージからの更新は無視される
        assertThat(repository.markCompleted(KEY, 1L, "worker-b", null, BASE_TIME)).isZero();
        assertThat(repository.markCompleted(KEY, 2L, "worker-a", null, BASE_TIME)).isZero();
        assertThat(repository.markFailed(KEY, 1L, "worker-b", "boom", BASE_TIME)).isEmpty();

        assertThat(repository.markCompleted(KEY, 1L, "worker-a", null, BASE_TIME)).isEqualTo(1);
    }

    @Test
    void retentionDeletesOnlyOldCompletedRows() {
        repository.claim("done", QUEUE, 1L, "w", BASE_TIME, BASE_TIME.minus(STALE_AFTER));
        repository.markCompleted("done", 1L, "w", null, BASE_TIME);
        repository.claim("failed", QUEUE, 2L, "w", BASE_TIME, BASE_TIME.minus(STALE_AFTER));
        repository.markFailed("failed", 2L, "w", "boom", BASE_TIME);

        Instant threshold = BASE_TIME.plusSeconds(1);

        assertThat(repository.countUnfinishedOlderThan(threshold)).isEqualTo(1);
        assertThat(repository.deleteCompletedOlderThan(threshold)).isEqualTo(1);
        assertThat(repository.findByKey("done")).isEmpty();
        assertThat(repository.findByKey("failed")).isPresent();
    }
}
