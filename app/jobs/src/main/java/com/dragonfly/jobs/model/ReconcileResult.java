/*
 * どこで: Jobs モデル
 * 何を: 取込件数の突合結果を表す
 * なぜ: 不一致を run の失敗として呼び出し元へ返すため
 */
package com.dragonfly.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconcileResult(
    @JsonProperty("is_valid") boolean valid, int expectedCount, int actualCount, int delta) {}
