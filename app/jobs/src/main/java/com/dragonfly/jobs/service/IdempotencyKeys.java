/*
 * どこで: Jobs サービス補助
 * 何を: payload から既定の冪等キーを導出する
 * なぜ: ハンドラがキーを上書きしない場合でも同一 payload の重複実行を防ぐため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.common.Digests;
import com.dragonfly.jobs.config.JobWorkerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IdempotencyKeys {

  private final JobWorkerProperties properties;

  // payload は jsonb から読み戻した正規化済みテキストなので、キー順の揺れはハッシュに影響しない
  public String derive(String queueName, String payloadJson) {
    return queueName + ":hash:" + Digests.hex(properties.idempotencyHashAlgorithm(), payloadJson);
  }
}
