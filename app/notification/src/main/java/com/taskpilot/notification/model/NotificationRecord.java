/*
 * どこで: Notification ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: 受付/バッチ/週次処理とデバッグ API で共通化するため
 */
package com.taskpilot.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
        UUID notificationId,
        NotificationPriority priority,
        NotificationChannel channel,
        String message,
        String eventKind,
        String sourceEntityId,
        String contextJson,
        Instant scheduledFor,
        Instant createdAt,
        Instant sentAt) {

    public boolean isPending() {
        return sentAt == null;
    }

    public NotificationRecord withSentAt(Instant sentAt) {
        return new NotificationRecord(
                notificationId,
                priority,
                channel,
                message,
                eventKind,
                sourceEntityId,
                contextJson,
                scheduledFor,
                createdAt,
                sentAt);
    }
}
