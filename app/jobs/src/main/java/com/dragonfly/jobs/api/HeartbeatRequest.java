package com.dragonfly.jobs.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** claim を保持している worker だけが延命できる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HeartbeatRequest(
    @NotBlank(message = "worker_id is required") @Size(max = 255) String workerId) {}
