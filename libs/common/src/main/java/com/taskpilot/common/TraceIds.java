/*
 * どこで: 共通ユーティリティ
 * 何を: 処理単位の相関 ID を発行する
 * なぜ: バッチ実行や受付処理のログを MDC で串刺しに追えるようにするため
 */
package com.taskpilot.common;

import java.util.UUID;

public final class TraceIds {
  public static final String MDC_RUN_ID = "run_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }
}
