package com.dragonfly.jobs.service;

import java.nio.file.Path;

/** ファイル名から決定的な source_batch_id を作る。 */
public final class BatchIds {

  private BatchIds() {}

  public static String of(String sourceSystem, String filename) {
    return of(sourceSystem, filename, null);
  }

  public static String of(String sourceSystem, String filename, String dateSuffix) {
    if (sourceSystem == null || sourceSystem.isBlank()) {
      throw new IllegalArgumentException("source_system is required");
    }
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("filename is required");
    }
    final String stem = stem(filename);
    if (dateSuffix == null || dateSuffix.isBlank()) {
      return sourceSystem + "/" + stem;
    }
    return sourceSystem + "/" + stem + "/" + dateSuffix;
  }

  private static String stem(String filename) {
    final Path name = Path.of(filename).getFileName();
    final String base = name == null ? filename : name.toString();
    final int dot = base.lastIndexOf('.');
    return dot > 0 ? base.substring(0, dot) : base;
  }
}
