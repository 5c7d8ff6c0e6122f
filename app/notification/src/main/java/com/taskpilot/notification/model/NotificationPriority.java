/*
 * どこで: Notification ドメインモデル
 * 何を: 通知の優先度ティアを表す列挙
 * なぜ: 配信タイミング/チャネル/重複抑止窓をティア単位で切り替えるため
 */
package com.taskpilot.notification.model;

public enum NotificationPriority {
  /** 即時送信。受付呼び出しの中で同期的に全チャネルへ送る。 */
  IMMEDIATE,
  /** 1 日数回のバッチ時刻にダイジェストとしてまとめて送る。 */
  BATCHED,
  /** 週 1 回の定刻に最新の 1 件だけを送る。 */
  WEEKLY,
  /** 人には届けない。監査ログにだけ残す。 */
  SILENT
}
