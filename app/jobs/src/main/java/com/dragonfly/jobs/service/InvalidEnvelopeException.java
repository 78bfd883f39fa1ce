/*
 * どこで: Jobs サービス層
 * 何を: 必須フィールド欠落などで処理不能な封筒を示す例外
 * なぜ: 一時障害と区別し、リトライせず即 dead letter にするため
 */
package com.dragonfly.jobs.service;

import java.util.List;

public class InvalidEnvelopeException extends RuntimeException {

  private final List<String> invalidFields;

  public InvalidEnvelopeException(List<String> invalidFields) {
    super("invalid job envelope: " + String.join(", ", invalidFields));
    this.invalidFields = List.copyOf(invalidFields);
  }

  public List<String> getInvalidFields() {
    return invalidFields;
  }
}
