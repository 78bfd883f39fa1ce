package com.dragonfly.jobs.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerHeartbeatRecord(
    String workerId,
    String queueName,
    String hostname,
    WorkerStatus status,
    long jobsProcessed,
    long jobsFailed,
    Instant startedAt,
    Instant lastSeenAt) {}
