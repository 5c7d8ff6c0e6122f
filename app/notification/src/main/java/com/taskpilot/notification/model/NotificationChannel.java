/*
 * どこで: Notification ドメインモデル
 * 何を: 配信チャネルの固定集合
 * なぜ: notifications.channel 列と送信アダプタの対応を型で固定するため
 */
package com.taskpilot.notification.model;

public enum NotificationChannel {
  PRIMARY_CHAT,
  SHORT_MESSAGE,
  LOG_ONLY
}
