/*
 * どこで: 共通ユーティリティ
 * 何を: 文字列/バイト列のダイジェストを 16 進文字列で返す
 * なぜ: 冪等キー・dedupe_key・ファイルハッシュで同じ計算を使い回すため
 */
package com.dragonfly.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Digests {

  public static final String SHA_256 = "SHA-256";

  private Digests() {}

  public static String hex(String algorithm, String value) {
    return hex(algorithm, value.getBytes(StandardCharsets.UTF_8));
  }

  public static String hex(String algorithm, byte[] value) {
    return toHex(newDigest(algorithm).digest(value));
  }

  public static MessageDigest newDigest(String algorithm) {
    try {
      return MessageDigest.getInstance(algorithm);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException(algorithm + " algorithm not available", ex);
    }
  }

  public static String toHex(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
