/*
 * どこで: Jobs 設定のバリデーションテスト
 * 何を: JobWorkerProperties の Bean Validation を検証する
 * なぜ: 起動時に不正なワーカー設定を検出できるようにするため
 */
package com.dragonfly.jobs.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobWorkerPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    assertTrue(validator.validate(properties(Duration.ofSeconds(30), 3, "SHA-256")).isEmpty());
  }

  @Test
  void validationFailsWhenVisibilityTimeoutIsZero() {
    assertFalse(validator.validate(properties(Duration.ZERO, 3, "SHA-256")).isEmpty());
  }

  @Test
  void validationFailsWhenMaxRetriesIsZero() {
    assertFalse(validator.validate(properties(Duration.ofSeconds(30), 0, "SHA-256")).isEmpty());
  }

  @Test
  void validationFailsWhenHashAlgorithmIsBlank() {
    assertFalse(validator.validate(properties(Duration.ofSeconds(30), 3, " ")).isEmpty());
  }

  private JobWorkerProperties properties(
      Duration visibilityTimeout, int maxRetries, String hashAlgorithm) {
    return new JobWorkerProperties(
        true,
        10,
        visibilityTimeout,
        Duration.ofSeconds(1),
        maxRetries,
        1,
        hashAlgorithm,
        1000,
        Duration.ofSeconds(15),
        Duration.ofSeconds(30));
  }
}
