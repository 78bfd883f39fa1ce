package com.dragonfly.jobs.model;

public enum ImportRowStatus {
  PENDING,
  PROMOTED,
  SKIPPED,
  FAILED,
  ROLLED_BACK
}
