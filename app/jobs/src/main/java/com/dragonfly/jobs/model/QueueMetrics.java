/*
 * どこで: Jobs モデル
 * 何を: キューごとの滞留状況を表す
 * なぜ: 運用 API とメトリクスで同じ集計を参照するため
 */
package com.dragonfly.jobs.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueMetrics(
    String queueName, long total, long oldestAgeSeconds, long inFlight, long readable) {}
