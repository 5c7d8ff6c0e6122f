/*
 * どこで: 通知トリガーの出力
 * 何を: 受信メッセージが一致したブロッカーと、解消/進展の判定、受付結果
 * なぜ: ブロッカーの解消処理自体は呼び出し側 (タスク管理) に任せるため
 */
package com.taskpilot.notification.trigger;

import com.taskpilot.notification.model.IntakeResult;

public record BlockerUpdate(String blockerId, boolean resolved, IntakeResult intakeResult) {}
