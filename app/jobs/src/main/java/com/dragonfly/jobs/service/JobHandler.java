/*
 * どこで: Jobs サービス層
 * 何を: キューごとの業務処理を差し込むための拡張点
 * なぜ: リース/冪等/DLQ の制御を JobWorker に集約し、業務側は処理本体だけを書けるようにするため
 */
package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.JobEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

public interface JobHandler {

  /** このハンドラが読み出すキュー名。 */
  String queueName();

  /**
   * ジョブ本体を実行する。例外を投げると失敗として扱われ、リース切れ後に再配信される。
   *
   * @return processed_jobs.result に保存する結果。不要なら null
   */
  JsonNode process(JobEnvelope envelope, JobContext context) throws Exception;

  /**
   * 冪等キーを上書きする。
   *
   * <p>既定では payload 全体のハッシュを使う。trace_id などリトライごとに変わる値を含む場合は、業務キーを返すこと。
   */
  default Optional<String> idempotencyKey(JobEnvelope envelope) {
    return Optional.empty();
  }
}
