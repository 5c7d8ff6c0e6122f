/*
 * どこで: 通知トリガー (検知器側の入力)
 * 何を: 分類対象の受信メッセージ
 * なぜ: 送信者/件名/本文だけでブロッカー照合を行うため
 */
package com.taskpilot.notification.trigger;

public record InboundMessage(String sender, String subject, String body) {}
