/*
 * どこで: Jobs モデル
 * 何を: 冪等キー claim の結果(Inserted / AlreadyExists)を表す
 * なぜ: 挿入できたかどうかと既存行の状態を 1 つの戻り値で扱うため
 */
package com.dragonfly.jobs.model;

public record JobClaimOutcome(boolean inserted, ProcessedJobRecord record) {

  public static JobClaimOutcome inserted(ProcessedJobRecord record) {
    return new JobClaimOutcome(true, record);
  }

  public static JobClaimOutcome alreadyExists(ProcessedJobRecord existing) {
    return new JobClaimOutcome(false, existing);
  }

  public ProcessedJobStatus existingStatus() {
    return inserted ? null : record.status();
  }
}
