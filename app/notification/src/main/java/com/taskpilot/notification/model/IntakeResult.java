/*
 * どこで: Notification ドメインモデル
 * 何を: 受付処理の戻り値 (結果種別 + 作成された通知)
 * なぜ: 抑止/ログのみ/作成を呼び出し元が分岐できるようにするため
 */
package com.taskpilot.notification.model;

import java.util.Optional;

public record IntakeResult(IntakeOutcome outcome, NotificationRecord notification) {

  public static IntakeResult created(NotificationRecord notification) {
    return new IntakeResult(IntakeOutcome.CREATED, notification);
  }

  public static IntakeResult suppressed() {
    return new IntakeResult(IntakeOutcome.SUPPRESSED, null);
  }

  public static IntakeResult logged() {
    return new IntakeResult(IntakeOutcome.LOGGED, null);
  }

  public boolean isSuppressed() {
    return outcome == IntakeOutcome.SUPPRESSED;
  }

  public Optional<NotificationRecord> notificationIfCreated() {
    return Optional.ofNullable(notification);
  }
}
