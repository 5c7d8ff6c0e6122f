/*
 * どこで: Notification API モデル
 * 何を: 通知受付の結果
 * なぜ: 抑止 (suppressed) を成功と区別して返すため
 */
package com.taskpilot.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpilot.notification.model.IntakeOutcome;
import com.taskpilot.notification.model.IntakeResult;
import com.taskpilot.notification.model.NotificationRecord;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IntakeResponse(
    IntakeOutcome outcome, UUID notificationId, Instant scheduledFor, Instant sentAt) {

  static IntakeResponse from(IntakeResult result) {
    final NotificationRecord notification = result.notification();
    if (notification == null) {
      return new IntakeResponse(result.outcome(), null, null, null);
    }
    return new IntakeResponse(
        result.outcome(),
        notification.notificationId(),
        notification.scheduledFor(),
        notification.sentAt());
  }
}
