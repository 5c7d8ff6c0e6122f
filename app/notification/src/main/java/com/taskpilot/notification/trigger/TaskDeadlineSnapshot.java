/*
 * どこで: 通知トリガー (検知器側の入力)
 * 何を: 期限チェック時点のタスク状態
 * なぜ: 検知ロジックを保存層から切り離した純粋関数として扱うため
 */
package com.taskpilot.notification.trigger;

import java.time.Instant;
import java.util.List;

public record TaskDeadlineSnapshot(
    String taskId, String title, Instant dueAt, boolean completed, List<String> missingPrerequisites) {

  public TaskDeadlineSnapshot {
    missingPrerequisites = missingPrerequisites == null ? List.of() : List.copyOf(missingPrerequisites);
  }
}
