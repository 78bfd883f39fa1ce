package com.dragonfly.jobs.service;

import com.dragonfly.common.Digests;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;

/** 取込ファイルの SHA-256。バッチ claim の file_hash に使う。 */
public final class FileHashes {

  private static final int BUFFER_SIZE = 8192;

  private FileHashes() {}

  public static String sha256(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return sha256(in);
    }
  }

  // ファイル全体をメモリに載せずにハッシュする
  public static String sha256(InputStream in) throws IOException {
    final MessageDigest digest = Digests.newDigest(Digests.SHA_256);
    final byte[] buffer = new byte[BUFFER_SIZE];
    int read;
    while ((read = in.read(buffer)) != -1) {
      digest.update(buffer, 0, read);
    }
    return Digests.toHex(digest.digest());
  }

  public static String sha256(byte[] content) {
    return Digests.hex(Digests.SHA_256, content);
  }
}
