/*
 * どこで: Notification API モデル
 * 何を: デバッグ用未送信一覧のレスポンス
 * なぜ: API レスポンスの構造を固定するため
 */
package com.taskpilot.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PendingNotificationsResponse(int count, List<NotificationSummary> notifications) {
  public PendingNotificationsResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを不変コピーにする
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
