package com.dragonfly.jobs.model;

public enum ProcessedJobStatus {
  PROCESSING,
  COMPLETED,
  FAILED
}
