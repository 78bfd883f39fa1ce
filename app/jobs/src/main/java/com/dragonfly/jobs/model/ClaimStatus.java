package com.dragonfly.jobs.model;

/** バッチ claim の判定結果。DUPLICATE は保存されるステータスではない。 */
public enum ClaimStatus {
  CLAIMED,
  DUPLICATE,
  IN_PROGRESS
}
