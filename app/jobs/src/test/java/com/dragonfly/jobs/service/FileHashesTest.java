package com.dragonfly.jobs.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileHashesTest {

  private static final String ABC_SHA256 =
      "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

  @TempDir Path tempDir;

  @Test
  void hashesBytesStreamsAndFilesIdentically() throws Exception {
    final byte[] content = "abc".getBytes(StandardCharsets.UTF_8);
    final Path file = tempDir.resolve("batch.csv");
    Files.write(file, content);

    assertThat(FileHashes.sha256(content)).isEqualTo(ABC_SHA256);
    assertThat(FileHashes.sha256(new ByteArrayInputStream(content))).isEqualTo(ABC_SHA256);
    assertThat(FileHashes.sha256(file)).isEqualTo(ABC_SHA256);
  }

  @Test
  void streamsContentLargerThanBuffer() throws Exception {
    final byte[] content = new byte[20_000];
    for (int i = 0; i < content.length; i++) {
      content[i] = (byte) (i % 251);
    }

    assertThat(FileHashes.sha256(new ByteArrayInputStream(content)))
        .isEqualTo(FileHashes.sha256(content));
  }
}
