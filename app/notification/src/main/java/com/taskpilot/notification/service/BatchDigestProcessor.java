/*
 * どこで: Notification サービス層
 * 何を: 配信時刻が到来した BATCHED 通知を 1 通のダイジェストで送り、成功時のみ一括で送信済みにする
 * なぜ: 送信失敗時に取りこぼさず、重複実行時に二重送信しないため
 */
package com.taskpilot.notification.service;

import com.taskpilot.common.TraceIds;
import com.taskpilot.notification.channel.ChannelDispatcher;
import com.taskpilot.notification.config.NotificationRoutingProperties;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import com.taskpilot.notification.repository.NotificationRepository;
import java.time.Duration;
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
public class BatchDigestProcessor {

  private static final Logger logger = LoggerFactory.getLogger(BatchDigestProcessor.class);
  static final String DIGEST_EVENT_KIND = "batch_digest";
  // 即時送信の途中にある行を閉じないための猶予
  static final Duration STALE_IMMEDIATE_GRACE = Duration.ofMinutes(10);

  private final NotificationRepository notificationRepository;
  private final ChannelDispatcher channelDispatcher;
  private final DigestFormatter digestFormatter;
  private final NotificationRoutingProperties routingProperties;
  private final NotificationAuditLog auditLog;
  private final NotificationMetrics metrics;
  private final DigestBacklogReporter backlogReporter;
  private final PlatformTransactionManager transactionManager;

  /**
   * 選択・送信・送信済み更新を 1 トランザクションで行い、ティアの実行ロックを保持したまま完了させる。
   *
   * @return 今回送信済みにした件数。対象なし・送信失敗・他の実行が進行中の場合は 0
   */
  public int runBatch(Instant now) {
    MDC.put(TraceIds.MDC_RUN_ID, TraceIds.newTraceId());
    try {
      final Integer marked = new TransactionTemplate(transactionManager).execute(status -> runLocked(now));
      backlogReporter.refresh();
      return marked == null ? 0 : marked;
    } finally {
      MDC.remove(TraceIds.MDC_RUN_ID);
    }
  }

  private int runLocked(Instant now) {
    if (!notificationRepository.tryLockDigestRun(NotificationPriority.BATCHED)) {
      logger.info("batch digest run skipped; another run holds the lock now={}", now);
      return 0;
    }
    sweepStaleImmediate(now);

    final List<NotificationRecord> due =
        notificationRepository.findPendingDue(NotificationPriority.BATCHED, now);
    if (due.isEmpty()) {
      logger.info("no batched notifications ready now={}", now);
      return 0;
    }

    final String digest = digestFormatter.format(due);
    final NotificationChannel channel =
        routingProperties.primaryChannel(NotificationPriority.BATCHED);
    if (!channelDispatcher.send(channel, digest)) {
      // 送信済みにしないので次回の実行で同じ行が再度対象になる
      logger.warn("batch digest send failed; items stay pending count={} channel={}", due.size(), channel);
      auditLog.record(
          NotificationPriority.BATCHED,
          DIGEST_EVENT_KIND,
          null,
          "Batch failed: " + due.size() + " items",
          "failed");
      return 0;
    }

    final List<UUID> ids = due.stream().map(NotificationRecord::notificationId).toList();
    final int marked = notificationRepository.markAllSent(ids, now);
    if (marked != ids.size()) {
      logger.warn(
          "batch digest marked fewer items than selected selected={} marked={}",
          ids.size(),
          marked);
    }
    logger.info("batch digest sent count={} channel={}", marked, channel);
    auditLog.record(
        NotificationPriority.BATCHED,
        DIGEST_EVENT_KIND,
        null,
        "Batch sent: " + marked + " items",
        "sent");
    metrics.recordDigestItemsSent(NotificationPriority.BATCHED, marked);
    return marked;
  }

  private void sweepStaleImmediate(Instant now) {
    final int closed =
        notificationRepository.markStaleImmediateSent(now.minus(STALE_IMMEDIATE_GRACE), now);
    if (closed > 0) {
      logger.warn("closed immediate notifications left without sent_at count={}", closed);
    }
  }
}
