/*
 * どこで: Notification API モデル
 * 何を: デバッグ用未送信一覧の要素
 * なぜ: 配信予定時刻とコンテキストを確認できるようにするため
 */
package com.taskpilot.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    NotificationPriority priority,
    NotificationChannel channel,
    String message,
    Instant scheduledFor,
    Instant createdAt,
    JsonNode context) {}
