package com.dragonfly.jobs.service;

import java.util.UUID;

public class ImportRunNotFoundException extends RuntimeException {

  public ImportRunNotFoundException(UUID runId) {
    super("import run not found: " + runId);
  }
}
