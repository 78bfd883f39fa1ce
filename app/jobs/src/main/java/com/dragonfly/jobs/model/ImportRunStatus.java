package com.dragonfly.jobs.model;

public enum ImportRunStatus {
  CLAIMED,
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  ROLLED_BACK;

  public boolean isActive() {
    return this == CLAIMED || this == IN_PROGRESS;
  }
}
