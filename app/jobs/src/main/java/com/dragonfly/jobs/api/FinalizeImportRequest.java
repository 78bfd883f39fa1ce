/*
 * どこで: Jobs API
 * 何を: 取込結果の件数と完了フラグを保持する
 * なぜ: finalize の入力を JSON から検証付きでバインドするため
 */
package com.dragonfly.jobs.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FinalizeImportRequest(
    @NotBlank(message = "worker_id is required") @Size(max = 255) String workerId,
    @NotNull(message = "rows_fetched is required") @PositiveOrZero Integer rowsFetched,
    @NotNull(message = "rows_inserted is required") @PositiveOrZero Integer rowsInserted,
    @NotNull(message = "rows_skipped is required") @PositiveOrZero Integer rowsSkipped,
    @NotNull(message = "rows_errored is required") @PositiveOrZero Integer rowsErrored,
    JsonNode errorDetails,
    Boolean markCompleted) {

  public boolean shouldMarkCompleted() {
    return markCompleted == null || markCompleted;
  }
}
