/*
 * どこで: 通知トリガー (検知器側の入力)
 * 何を: 未解決ブロッカーの待ち相手と監視パターン
 * なぜ: 受信メッセージとの照合に必要な項目だけを渡すため
 */
package com.taskpilot.notification.trigger;

public record BlockerSnapshot(
    String blockerId, String description, String waitingOn, String watchPattern) {}
