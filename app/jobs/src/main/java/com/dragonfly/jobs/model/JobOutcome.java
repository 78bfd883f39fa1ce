/*
 * どこで: Jobs モデル
 * 何を: メッセージ 1 件の処理結果を列挙する
 * なぜ: メトリクスのタグと稼働カウンタで同じ分類を使うため
 */
package com.dragonfly.jobs.model;

import java.util.Locale;

public enum JobOutcome {
  COMPLETED,
  DUPLICATE,
  DEFERRED,
  FAILED,
  DEAD_LETTERED,
  INVALID,
  POISON,
  LOCK_LOST;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isFailure() {
    return this == FAILED || this == DEAD_LETTERED || this == INVALID || this == POISON;
  }
}
