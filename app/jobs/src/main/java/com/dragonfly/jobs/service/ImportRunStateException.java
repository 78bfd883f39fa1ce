/*
 * どこで: Jobs サービス層
 * 何を: import run の状態遷移として許されない操作を示す例外
 * なぜ: rolled_back の run への追記などを 409 として呼び出し元へ返すため
 */
package com.dragonfly.jobs.service;

public class ImportRunStateException extends RuntimeException {

  public ImportRunStateException(String message) {
    super(message);
  }
}
