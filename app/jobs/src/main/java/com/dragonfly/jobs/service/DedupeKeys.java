/*
 * どこで: Jobs サービス補助
 * 何を: source_system と自然キーから決定的な dedupe_key を作る
 * なぜ: 表記揺れがあっても同じ行を 1 件として扱うため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.common.Digests;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Pattern;

public final class DedupeKeys {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private DedupeKeys() {}

  public static String derive(String sourceSystem, String... naturalKeyParts) {
    if (sourceSystem == null || sourceSystem.isBlank()) {
      throw new IllegalArgumentException("source_system is required");
    }
    if (naturalKeyParts == null || naturalKeyParts.length == 0) {
      throw new IllegalArgumentException("natural key is required");
    }
    final StringJoiner joiner = new StringJoiner("|");
    joiner.add(normalize(sourceSystem));
    boolean hasValue = false;
    for (String part : naturalKeyParts) {
      final String normalized = part == null ? "" : normalize(part);
      hasValue |= !normalized.isEmpty();
      joiner.add(normalized);
    }
    if (!hasValue) {
      throw new IllegalArgumentException("natural key is required");
    }
    return Digests.hex(Digests.SHA_256, joiner.toString());
  }

  static String normalize(String value) {
    return WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }
}
