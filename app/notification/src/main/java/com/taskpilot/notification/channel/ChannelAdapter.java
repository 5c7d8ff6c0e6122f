/*
 * どこで: Notification 送信層
 * 何を: 配信チャネルへの送信を抽象化するインターフェース
 * なぜ: 実送信 (チャット Bot / SMS ゲートウェイ) とテスト差し替えを容易にするため
 */
package com.taskpilot.notification.channel;

import com.taskpilot.notification.model.NotificationChannel;

/**
 * 1 チャネルへ整形済みテキストを送る。失敗は RuntimeException で通知する。
 *
 * <p>再送やバックオフは実装側の責務で、呼び出し側は成功/失敗しか見ない。
 */
public interface ChannelAdapter {
  void send(NotificationChannel channel, String renderedText);
}
