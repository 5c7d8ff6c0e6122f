/*
 * どこで: Notification ドメインモデル
 * 何を: 受付処理の結果種別
 * なぜ: 重複抑止を成功とも失敗とも区別して呼び出し元へ返すため
 */
package com.taskpilot.notification.model;

public enum IntakeOutcome {
  CREATED,
  SUPPRESSED,
  LOGGED
}
