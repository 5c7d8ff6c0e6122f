/*
 * どこで: Notification サービス層
 * 何を: 配信時刻が到来した WEEKLY 通知のうち最新 1 件だけをそのまま送る
 * なぜ: 古い週次レポートを再送せず、成功時に保留分をまとめて閉じるため
 */
package com.taskpilot.notification.service;

import com.taskpilot.common.TraceIds;
import com.taskpilot.notification.channel.ChannelDispatcher;
import com.taskpilot.notification.config.NotificationRoutingProperties;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import com.taskpilot.notification.repository.NotificationRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class WeeklyDigestProcessor {

  private static final Logger logger = LoggerFactory.getLogger(WeeklyDigestProcessor.class);

  private final NotificationRepository notificationRepository;
  private final ChannelDispatcher channelDispatcher;
  private final NotificationRoutingProperties routingProperties;
  private final NotificationAuditLog auditLog;
  private final NotificationMetrics metrics;
  private final DigestBacklogReporter backlogReporter;
  private final PlatformTransactionManager transactionManager;

  /**
   * @return 送信できた場合 true。対象なし・送信失敗・他の実行が進行中の場合は false
   */
  public boolean runWeekly(Instant now) {
    MDC.put(TraceIds.MDC_RUN_ID, TraceIds.newTraceId());
    try {
      final Boolean sent = new TransactionTemplate(transactionManager).execute(status -> runLocked(now));
      backlogReporter.refresh();
      return Boolean.TRUE.equals(sent);
    } finally {
      MDC.remove(TraceIds.MDC_RUN_ID);
    }
  }

  private boolean runLocked(Instant now) {
    if (!notificationRepository.tryLockDigestRun(NotificationPriority.WEEKLY)) {
      logger.info("weekly digest run skipped; another run holds the lock now={}", now);
      return false;
    }
    final List<NotificationRecord> due =
        notificationRepository.findPendingDue(NotificationPriority.WEEKLY, now);
    if (due.isEmpty()) {
      logger.info("no weekly notification pending now={}", now);
      return false;
    }
    if (due.size() > 1) {
      logger.warn("multiple weekly notifications pending count={}; sending latest only", due.size());
    }

    // 作成昇順なので末尾が最新
    final NotificationRecord latest = due.get(due.size() - 1);
    final NotificationChannel channel =
        routingProperties.primaryChannel(NotificationPriority.WEEKLY);
    if (!channelDispatcher.send(channel, latest.message())) {
      logger.warn("weekly digest send failed; items stay pending id={}", latest.notificationId());
      auditLog.record(
          NotificationPriority.WEEKLY,
          latest.eventKind(),
          latest.sourceEntityId(),
          latest.message(),
          "failed");
      return false;
    }

    final List<UUID> ids = due.stream().map(NotificationRecord::notificationId).toList();
    final int marked = notificationRepository.markAllSent(ids, now);
    logger.info("weekly digest sent id={} closed={}", latest.notificationId(), marked);
    auditLog.record(
        NotificationPriority.WEEKLY,
        latest.eventKind(),
        latest.sourceEntityId(),
        latest.message(),
        "sent");
    metrics.recordDigestItemsSent(NotificationPriority.WEEKLY, marked);
    return true;
  }
}
