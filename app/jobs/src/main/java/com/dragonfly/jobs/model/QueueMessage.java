/*
 * どこで: Jobs モデル
 * 何を: キューから読み出したメッセージ 1 件を表す
 * なぜ: リース状態(read_count/visibility_deadline)をワーカーへ渡すため
 */
package com.dragonfly.jobs.model;

import java.time.Instant;

public record QueueMessage(
    long msgId,
    String queueName,
    String payloadJson,
    Instant enqueuedAt,
    int readCount,
    Instant visibilityDeadline) {}
