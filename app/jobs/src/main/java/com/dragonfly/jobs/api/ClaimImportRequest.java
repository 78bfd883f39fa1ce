/*
 * どこで: Jobs API
 * 何を: バッチ claim リクエストの入力を保持する
 * なぜ: (source_system, source_batch_id, file_hash) の必須検証をバインド時に行うため
 */
package com.dragonfly.jobs.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClaimImportRequest(
    @NotBlank(message = "source_system is required") @Size(max = 128) String sourceSystem,
    @NotBlank(message = "source_batch_id is required") @Size(max = 255) String sourceBatchId,
    @NotBlank(message = "file_hash is required") @Size(max = 128) String fileHash,
    @Size(max = 512) String filename,
    @Size(max = 64) String importKind,
    @NotBlank(message = "worker_id is required") @Size(max = 255) String workerId) {}
