/*
 * どこで: Jobs API
 * 何を: import_runs の 1 行を API 応答の形に変換する
 * なぜ: error_details を文字列ではなく JSON オブジェクトとして返すため
 */
package com.dragonfly.jobs.api;

import com.dragonfly.jobs.model.ImportRunRecord;
import com.dragonfly.jobs.model.ImportRunStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImportRunView(
    UUID runId,
    String sourceSystem,
    String sourceBatchId,
    String fileHash,
    String filename,
    String importKind,
    ImportRunStatus status,
    Integer rowsFetched,
    Integer rowsInserted,
    Integer rowsSkipped,
    Integer rowsErrored,
    String workerId,
    Instant claimedAt,
    Instant heartbeatAt,
    Instant completedAt,
    Instant reconciledAt,
    Instant rolledBackAt,
    String rollbackReason,
    JsonNode errorDetails) {

  static ImportRunView from(ImportRunRecord run, ObjectMapper objectMapper) {
    return new ImportRunView(
        run.runId(),
        run.sourceSystem(),
        run.sourceBatchId(),
        run.fileHash(),
        run.filename(),
        run.importKind(),
        run.status(),
        run.rowsFetched(),
        run.rowsInserted(),
        run.rowsSkipped(),
        run.rowsErrored(),
        run.workerId(),
        run.claimedAt(),
        run.heartbeatAt(),
        run.completedAt(),
        run.reconciledAt(),
        run.rolledBackAt(),
        run.rollbackReason(),
        parse(run.errorDetailsJson(), objectMapper));
  }

  private static JsonNode parse(String json, ObjectMapper objectMapper) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored error_details is not valid JSON", ex);
    }
  }
}
