package com.dragonfly.jobs.service;

public class DeadLetterNotFoundException extends RuntimeException {

  public DeadLetterNotFoundException(long dlqId) {
    super("dead letter not found: " + dlqId);
  }
}
