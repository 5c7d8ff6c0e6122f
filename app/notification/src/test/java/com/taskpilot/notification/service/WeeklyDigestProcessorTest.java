/*
 * どこで: 週次レポート処理のユニットテスト
 * 何を: 最新 1 件だけを送り、成功時に保留分をまとめて閉じることを検証する
 * なぜ: 古い週次レポートを再送しないことを保証するため
 */
package com.taskpilot.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.taskpilot.notification.channel.ChannelDispatcher;
import com.taskpilot.notification.config.NotificationRoutingProperties;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import com.taskpilot.notification.repository.NotificationRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WeeklyDigestProcessorTest {

  private static final Instant RUN_AT = Instant.parse("2026-10-25T20:00:00Z");

  @Mock private NotificationRepository notificationRepository;
  @Mock private ChannelDispatcher channelDispatcher;
  @Mock private NotificationAuditLog auditLog;
  @Mock private NotificationMetrics metrics;

  private WeeklyDigestProcessor processor;

  @BeforeEach
  void setUp() {
    processor =
        new WeeklyDigestProcessor(
            notificationRepository,
            channelDispatcher,
            new NotificationRoutingProperties(null, null, null, 160),
            auditLog,
            metrics,
            new DigestBacklogReporter(notificationRepository, metrics),
            new NoOpTransactionManager());
  }

  private void lockAcquired() {
    when(notificationRepository.tryLockDigestRun(NotificationPriority.WEEKLY)).thenReturn(true);
  }

  @Test
  void noPendingReportReturnsFalse() {
    lockAcquired();
    when(notificationRepository.findPendingDue(NotificationPriority.WEEKLY, RUN_AT))
        .thenReturn(List.of());

    assertThat(processor.runWeekly(RUN_AT)).isFalse();

    verifyNoInteractions(channelDispatcher);
  }

  @Test
  void sendsOnlyLatestReportAndClosesAll() {
    lockAcquired();
    final NotificationRecord older = report("draft report", "2026-10-21T08:00:00Z");
    final NotificationRecord newer = report("final report", "2026-10-24T08:00:00Z");
    when(notificationRepository.findPendingDue(NotificationPriority.WEEKLY, RUN_AT))
        .thenReturn(List.of(older, newer));
    when(channelDispatcher.send(NotificationChannel.PRIMARY_CHAT, "final report")).thenReturn(true);
    when(notificationRepository.markAllSent(
            List.of(older.notificationId(), newer.notificationId()), RUN_AT))
        .thenReturn(2);

    assertThat(processor.runWeekly(RUN_AT)).isTrue();

    verify(channelDispatcher, never()).send(NotificationChannel.PRIMARY_CHAT, "draft report");
    verify(metrics).recordDigestItemsSent(NotificationPriority.WEEKLY, 2);
  }

  @Test
  void failedSendLeavesReportsPending() {
    lockAcquired();
    final NotificationRecord report = report("final report", "2026-10-24T08:00:00Z");
    when(notificationRepository.findPendingDue(NotificationPriority.WEEKLY, RUN_AT))
        .thenReturn(List.of(report));
    when(channelDispatcher.send(any(), anyString())).thenReturn(false);

    assertThat(processor.runWeekly(RUN_AT)).isFalse();

    verify(notificationRepository, never()).markAllSent(any(), any());
  }

  @Test
  void runHeldByAnotherProcessSkipsWithoutSending() {
    when(notificationRepository.tryLockDigestRun(NotificationPriority.WEEKLY)).thenReturn(false);

    assertThat(processor.runWeekly(RUN_AT)).isFalse();

    verify(notificationRepository, never()).findPendingDue(any(), any());
    verifyNoInteractions(channelDispatcher);
  }

  private NotificationRecord report(String text, String createdAt) {
    return new NotificationRecord(
        UUID.randomUUID(),
        NotificationPriority.WEEKLY,
        NotificationChannel.PRIMARY_CHAT,
        text,
        "weekly_report",
        UUID.randomUUID().toString(),
        "{}",
        RUN_AT,
        Instant.parse(createdAt),
        null);
  }
}
