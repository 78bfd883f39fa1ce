/*
 * どこで: Jobs 運用 API
 * 何を: キュー/取込 run/dead letter/ワーカーの参照と dead letter の再投入を提供する
 * なぜ: 障害調査と復旧を SQL を直接叩かずに行えるようにするため
 */
package com.dragonfly.jobs.api;

import com.dragonfly.jobs.model.QueueMetrics;
import com.dragonfly.jobs.model.ReplayResult;
import com.dragonfly.jobs.model.WorkerHeartbeatRecord;
import com.dragonfly.jobs.service.BatchClaimCoordinator;
import com.dragonfly.jobs.service.DeadLetterNotFoundException;
import com.dragonfly.jobs.service.DeadLetterReplayer;
import com.dragonfly.jobs.service.JobOperationsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ops")
@RequiredArgsConstructor
@Validated
public class OpsController {

  private static final String DEFAULT_LIMIT = "50";

  private final JobOperationsService operationsService;
  private final BatchClaimCoordinator coordinator;
  private final DeadLetterReplayer deadLetterReplayer;
  private final ObjectMapper objectMapper;

  @GetMapping("/queues")
  public List<QueueMetrics> queues() {
    return operationsService.queueOverview();
  }

  @GetMapping("/queues/{queue}/metrics")
  public QueueMetrics queueMetrics(@PathVariable("queue") String queueName) {
    return operationsService.queueMetrics(queueName);
  }

  @GetMapping("/import-runs")
  public List<ImportRunView> importRuns(
      @RequestParam(name = "limit", defaultValue = DEFAULT_LIMIT)
          @Min(value = 1, message = "limit must be at least 1")
          @Max(value = 500, message = "limit must be at most 500")
          int limit) {
    return coordinator.recentRuns(limit).stream()
        .map(run -> ImportRunView.from(run, objectMapper))
        .collect(Collectors.toList());
  }

  @GetMapping("/import-runs/stale")
  public List<ImportRunView> staleImportRuns(
      @RequestParam(name = "limit", defaultValue = DEFAULT_LIMIT)
          @Min(value = 1, message = "limit must be at least 1")
          @Max(value = 500, message = "limit must be at most 500")
          int limit) {
    return coordinator.staleRuns(limit).stream()
        .map(run -> ImportRunView.from(run, objectMapper))
        .collect(Collectors.toList());
  }

  @GetMapping("/dead-letters")
  public List<DeadLetterView> deadLetters(
      @RequestParam(name = "queue", required = false) String queueName,
      @RequestParam(name = "limit", defaultValue = DEFAULT_LIMIT)
          @Min(value = 1, message = "limit must be at least 1")
          @Max(value = 500, message = "limit must be at most 500")
          int limit) {
    return deadLetterReplayer.list(queueName, limit).stream()
        .map(entry -> DeadLetterView.from(entry, objectMapper))
        .collect(Collectors.toList());
  }

  @GetMapping("/dead-letters/{dlq_id}")
  public DeadLetterView deadLetter(@PathVariable("dlq_id") long dlqId) {
    return deadLetterReplayer
        .find(dlqId)
        .map(entry -> DeadLetterView.from(entry, objectMapper))
        .orElseThrow(() -> new DeadLetterNotFoundException(dlqId));
  }

  @PostMapping("/dead-letters/{dlq_id}/replay")
  public ReplayResult replay(@PathVariable("dlq_id") long dlqId) {
    return deadLetterReplayer.replay(dlqId);
  }

  @GetMapping("/workers")
  public List<WorkerHeartbeatRecord> workers() {
    return operationsService.workers();
  }
}
