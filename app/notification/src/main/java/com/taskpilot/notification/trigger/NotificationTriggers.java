/*
 * どこで: 通知トリガー
 * 何を: タスク/ブロッカー/WIP/週次レポートの状態変化を優先度付きの受付呼び出しへ変換する
 * なぜ: 各検知器が優先度と event_kind の対応を個別に持たないようにするため
 */
package com.taskpilot.notification.trigger;

import com.taskpilot.notification.model.IntakeResult;
import com.taskpilot.notification.model.NotificationRecord;
import com.taskpilot.notification.service.NotificationRouter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationTriggers {

  public static final String DEADLINE_URGENT = "deadline_urgent";
  public static final String BLOCKER_RESOLVED = "blocker_resolved";
  public static final String BLOCKER_ESCALATION = "blocker_escalation";
  public static final String TASK_STATUS = "task_status";
  public static final String WIP_WARNING = "wip_warning";
  public static final String NEW_BLOCKER = "new_blocker";
  public static final String WEEKLY_REPORT = "weekly_report";

  static final Duration URGENT_DEADLINE_HORIZON = Duration.ofHours(24);
  private static final int LISTED_PREREQUISITES = 3;

  private final NotificationRouter router;
  private final Clock clock;

  /** 24 時間以内が期限で前提が揃っていない未完了タスクを即時通知する。 */
  public List<NotificationRecord> checkUrgentDeadlines(List<TaskDeadlineSnapshot> tasks) {
    final Instant now = Instant.now(clock);
    final Instant horizon = now.plus(URGENT_DEADLINE_HORIZON);
    final List<NotificationRecord> created = new ArrayList<>();
    for (TaskDeadlineSnapshot task : tasks) {
      if (task.completed()
          || task.dueAt() == null
          || task.dueAt().isAfter(horizon)
          || task.missingPrerequisites().isEmpty()) {
        continue;
      }
      final long hoursLeft = TriggerHeuristics.hoursUntil(task.dueAt(), now);
      final List<String> missing = task.missingPrerequisites();
      final String items =
          String.join(", ", missing.subList(0, Math.min(LISTED_PREREQUISITES, missing.size())));
      final String message =
          "'" + task.title() + "' due in " + hoursLeft + "h, waiting on: " + items;
      router
          .intakeImmediate(
              message,
              DEADLINE_URGENT,
              task.taskId(),
              Map.of("hours_left", hoursLeft, "incomplete_items", missing.size()))
          .notificationIfCreated()
          .ifPresent(created::add);
    }
    return created;
  }

  /** 受信メッセージが一致したブロッカーごとに解消/進展を即時通知する。 */
  public List<BlockerUpdate> checkBlockerUpdates(
      InboundMessage message, List<BlockerSnapshot> openBlockers) {
    final List<BlockerUpdate> updates = new ArrayList<>();
    for (BlockerSnapshot blocker : openBlockers) {
      if (!TriggerHeuristics.matchesBlocker(blocker, message)) {
        continue;
      }
      final boolean resolved = TriggerHeuristics.isResolution(message);
      final String text =
          resolved
              ? "UNBLOCKED: " + blocker.description() + " - Message from " + message.sender()
              : "BLOCKER UPDATE: " + blocker.description() + " - " + message.sender() + " sent update";
      final Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("sender", message.sender());
      metadata.put("subject", message.subject());
      final IntakeResult result =
          router.intakeImmediate(
              text, resolved ? BLOCKER_RESOLVED : BLOCKER_ESCALATION, blocker.blockerId(), metadata);
      updates.add(new BlockerUpdate(blocker.blockerId(), resolved, result));
    }
    return updates;
  }

  public IntakeResult notifyTaskStatusChange(
      String taskId, String title, String oldStatus, String newStatus) {
    final String message = "Task '" + title + "': " + oldStatus + " -> " + newStatus;
    return router.intakeBatched(
        message, TASK_STATUS, taskId, Map.of("old_status", oldStatus, "new_status", newStatus));
  }

  /** WIP が上限の 1 つ手前に達したら通知する。キーはシステム全体で 1 つ。 */
  public Optional<IntakeResult> notifyWipWarning(int currentWip, int wipLimit) {
    if (currentWip < wipLimit - 1) {
      return Optional.empty();
    }
    final String message =
        currentWip >= wipLimit
            ? "WIP at " + currentWip + "/" + wipLimit + " - AT LIMIT"
            : "WIP at " + currentWip + "/" + wipLimit + " - one slot remaining";
    return Optional.of(
        router.intakeBatched(
            message, WIP_WARNING, null, Map.of("current", currentWip, "limit", wipLimit)));
  }

  public IntakeResult notifyNewBlocker(String blockerId, String description, String waitingOn) {
    final String message =
        waitingOn == null || waitingOn.isBlank()
            ? "New blocker: " + description
            : "New blocker: " + description + " (waiting on " + waitingOn + ")";
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("description", description);
    metadata.put("waiting_on", waitingOn);
    return router.intakeBatched(message, NEW_BLOCKER, blockerId, metadata);
  }

  /** reportId ごとに重複抑止される。同じ週の改訂版は別 ID で渡す。 */
  public IntakeResult submitWeeklyReport(String reportId, String reportText) {
    return router.intakeWeekly(reportText, WEEKLY_REPORT, reportId, Map.of());
  }
}
