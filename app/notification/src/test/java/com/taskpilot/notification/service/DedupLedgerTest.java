/*
 * どこで: 重複抑止台帳サービスのユニットテスト
 * 何を: 抑止窓の境界と event_kind 上書きの優先を検証する
 * なぜ: 窓の端で二重通知や取りこぼしが起きないことを保証するため
 */
package com.taskpilot.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.taskpilot.notification.config.NotificationRoutingProperties;
import com.taskpilot.notification.model.DedupEntry;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.repository.DedupLedgerRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DedupLedgerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-10-19T12:00:00Z");

  @Mock private DedupLedgerRepository repository;

  private DedupLedger dedupLedger;

  @BeforeEach
  void setUp() {
    final NotificationRoutingProperties properties =
        new NotificationRoutingProperties(
            null, Map.of("deadline_urgent", Duration.ofHours(2)), null, 160);
    dedupLedger =
        new DedupLedger(repository, properties, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void entryInsideWindowIsDuplicate() {
    givenLastSent("blocker_resolved", "b1", FIXED_NOW.minus(Duration.ofHours(3)));

    assertThat(dedupLedger.isDuplicate(NotificationPriority.IMMEDIATE, "blocker_resolved", "b1"))
        .isTrue();
  }

  @Test
  void entryExactlyAtWindowEdgeIsNotDuplicate() {
    // last_sent_at が now - cooldown ちょうどなら窓の外
    givenLastSent("blocker_resolved", "b1", FIXED_NOW.minus(Duration.ofHours(4)));

    assertThat(dedupLedger.isDuplicate(NotificationPriority.IMMEDIATE, "blocker_resolved", "b1"))
        .isFalse();
  }

  @Test
  void missingEntryIsNotDuplicate() {
    when(repository.find("task_status", "task-1")).thenReturn(Optional.empty());

    assertThat(dedupLedger.isDuplicate(NotificationPriority.BATCHED, "task_status", "task-1"))
        .isFalse();
  }

  @Test
  void eventKindOverrideWinsOverPriorityDefault() {
    givenLastSent("deadline_urgent", "task-1", FIXED_NOW.minus(Duration.ofHours(3)));

    assertThat(dedupLedger.isDuplicate(NotificationPriority.IMMEDIATE, "deadline_urgent", "task-1"))
        .isFalse();
  }

  @Test
  void tryRecordPassesThresholdFromPriorityCooldown() {
    when(repository.upsertIfExpired(
            "task_status", "task-1", FIXED_NOW, FIXED_NOW.minus(Duration.ofHours(8))))
        .thenReturn(true);

    assertThat(dedupLedger.tryRecord(NotificationPriority.BATCHED, "task_status", "task-1", FIXED_NOW))
        .isTrue();
  }

  @Test
  void recordUpsertsAtNow() {
    dedupLedger.record(NotificationPriority.WEEKLY, "weekly_report", null);

    verify(repository).upsert("weekly_report", null, FIXED_NOW);
  }

  private void givenLastSent(String eventKind, String sourceEntityId, Instant lastSentAt) {
    when(repository.find(eventKind, sourceEntityId))
        .thenReturn(Optional.of(new DedupEntry(eventKind, sourceEntityId, lastSentAt)));
  }
}
