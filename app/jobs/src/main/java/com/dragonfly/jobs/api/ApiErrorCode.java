/*
 * どこで: Jobs API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.dragonfly.jobs.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    INVALID_ENVELOPE,
    IMPORT_RUN_NOT_FOUND,
    DEAD_LETTER_NOT_FOUND,
    IMPORT_RUN_STATE_CONFLICT
}
