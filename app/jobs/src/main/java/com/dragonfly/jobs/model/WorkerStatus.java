package com.dragonfly.jobs.model;

public enum WorkerStatus {
  STARTING,
  HEALTHY,
  STOPPED
}
