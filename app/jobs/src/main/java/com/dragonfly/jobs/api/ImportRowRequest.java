/*
 * どこで: Jobs API
 * 何を: staging 行 1 件の自然キーと payload を保持する
 * なぜ: dedupe_key の導出元を呼び出し側に明示させるため
 */
package com.dragonfly.jobs.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImportRowRequest(
    @NotBlank(message = "worker_id is required") @Size(max = 255) String workerId,
    @NotEmpty(message = "natural_key is required") List<String> naturalKey,
    JsonNode payload) {}
