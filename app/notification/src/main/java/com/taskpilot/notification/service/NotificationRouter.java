/*
 * どこで: Notification サービス層
 * 何を: 優先度ごとの受付 (重複抑止 → 保存 → 即時送信 or 配信予約) を行う
 * なぜ: 検知器が増えても、いつ・どう人に伝えるかの判断をここに集約するため
 */
package com.taskpilot.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.taskpilot.notification.channel.ChannelDispatcher;
import com.taskpilot.notification.config.NotificationRoutingProperties;
import com.taskpilot.notification.model.IntakeOutcome;
import com.taskpilot.notification.model.IntakeResult;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import com.taskpilot.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationRouter {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRouter.class);
  // notifications / dedup_ledger の列長と一致させる
  public static final int EVENT_KIND_MAX_LENGTH = 128;
  public static final int SOURCE_ENTITY_ID_MAX_LENGTH = 256;

  private final NotificationRepository notificationRepository;
  private final DedupLedger dedupLedger;
  private final ChannelDispatcher channelDispatcher;
  private final DeliverySchedule deliverySchedule;
  private final NotificationRoutingProperties routingProperties;
  private final NotificationAuditLog auditLog;
  private final NotificationMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public IntakeResult intakeImmediate(
      String message, String eventKind, String sourceEntityId, Map<String, ?> metadata) {
    return intake(NotificationPriority.IMMEDIATE, message, eventKind, sourceEntityId, metadata);
  }

  public IntakeResult intakeBatched(
      String message, String eventKind, String sourceEntityId, Map<String, ?> metadata) {
    return intake(NotificationPriority.BATCHED, message, eventKind, sourceEntityId, metadata);
  }

  public IntakeResult intakeWeekly(
      String message, String eventKind, String sourceEntityId, Map<String, ?> metadata) {
    return intake(NotificationPriority.WEEKLY, message, eventKind, sourceEntityId, metadata);
  }

  public IntakeResult intakeSilent(
      String message, String eventKind, String sourceEntityId, Map<String, ?> metadata) {
    return intake(NotificationPriority.SILENT, message, eventKind, sourceEntityId, metadata);
  }

  /**
   * 通知を 1 件受け付ける。
   *
   * <p>event_kind は任意の文字列で、未知の種別は優先度の既定ポリシーで扱う。保存層の障害は
   * DataAccessException のまま呼び出し元へ伝播し、その場合は重複抑止台帳も通知も書かれない。
   */
  public IntakeResult intake(
      NotificationPriority priority,
      String message,
      String eventKind,
      String sourceEntityId,
      Map<String, ?> metadata) {
    validate(priority, message, eventKind, sourceEntityId);
    final Instant now = Instant.now(clock);
    if (priority == NotificationPriority.SILENT) {
      return intakeSilentAt(message, eventKind, sourceEntityId, now);
    }

    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            priority,
            routingProperties.primaryChannel(priority),
            message,
            eventKind,
            sourceEntityId,
            serializeContext(eventKind, sourceEntityId, metadata),
            scheduledFor(priority, now),
            now,
            null);

    // 重複抑止の記録と通知の保存は同一トランザクション。どちらか一方だけが残ることはない
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Boolean created =
        transactionTemplate.execute(
            status -> {
              if (!dedupLedger.tryRecord(priority, eventKind, sourceEntityId, now)) {
                return false;
              }
              notificationRepository.insert(record);
              return true;
            });
    if (!Boolean.TRUE.equals(created)) {
      return suppressed(priority, message, eventKind, sourceEntityId);
    }

    if (priority == NotificationPriority.IMMEDIATE) {
      final NotificationRecord sent = deliverImmediately(record);
      metrics.recordIntake(priority, IntakeOutcome.CREATED);
      return IntakeResult.created(sent);
    }

    logger.info(
        "notification queued id={} priority={} eventKind={} scheduledFor={}",
        record.notificationId(),
        priority,
        eventKind,
        record.scheduledFor());
    auditLog.record(
        priority, eventKind, sourceEntityId, message, "queued for " + record.scheduledFor());
    metrics.recordIntake(priority, IntakeOutcome.CREATED);
    return IntakeResult.created(record);
  }

  private IntakeResult intakeSilentAt(
      String message, String eventKind, String sourceEntityId, Instant now) {
    // 保存はしないが、同じログを繰り返さないよう重複抑止台帳には参加する
    final Boolean recorded =
        new TransactionTemplate(transactionManager)
            .execute(
                status ->
                    dedupLedger.tryRecord(
                        NotificationPriority.SILENT, eventKind, sourceEntityId, now));
    if (!Boolean.TRUE.equals(recorded)) {
      return suppressed(NotificationPriority.SILENT, message, eventKind, sourceEntityId);
    }
    logger.info("silent notification logged eventKind={} sourceEntityId={}", eventKind, sourceEntityId);
    auditLog.record(NotificationPriority.SILENT, eventKind, sourceEntityId, message, "logged");
    metrics.recordIntake(NotificationPriority.SILENT, IntakeOutcome.LOGGED);
    return IntakeResult.logged();
  }

  /**
   * 全チャネルへ同期送信し、個々の結果に関わらず送信済みにする。
   *
   * <p>冗長チャネルへのベストエフォート送信なので、失敗はログに残すだけで再送しない。
   */
  private NotificationRecord deliverImmediately(NotificationRecord record) {
    final List<NotificationChannel> failedChannels = new ArrayList<>();
    for (NotificationChannel channel :
        routingProperties.channelsFor(NotificationPriority.IMMEDIATE)) {
      final boolean delivered = channelDispatcher.send(channel, render(channel, record.message()));
      if (!delivered) {
        failedChannels.add(channel);
      }
    }
    final Instant sentAt = Instant.now(clock);
    try {
      final int updated = notificationRepository.markSent(record.notificationId(), sentAt);
      if (updated == 0) {
        logger.warn("immediate notification was already marked sent id={}", record.notificationId());
      }
    } catch (DataAccessException ex) {
      // 送信と受付は確定済み。取り残された行はバッチ実行時の掃除で送信済みになる
      logger.error(
          "failed to mark immediate notification sent; left for sweep id={}",
          record.notificationId(),
          ex);
    }
    if (!failedChannels.isEmpty()) {
      logger.warn(
          "immediate notification delivered with channel failures id={} eventKind={} failed={}",
          record.notificationId(),
          record.eventKind(),
          failedChannels);
    }
    auditLog.record(
        NotificationPriority.IMMEDIATE,
        record.eventKind(),
        record.sourceEntityId(),
        record.message(),
        failedChannels.isEmpty() ? "sent" : "sent,failed=" + failedChannels);
    return record.withSentAt(sentAt);
  }

  private IntakeResult suppressed(
      NotificationPriority priority, String message, String eventKind, String sourceEntityId) {
    logger.info(
        "notification suppressed priority={} eventKind={} sourceEntityId={}",
        priority,
        eventKind,
        sourceEntityId);
    auditLog.record(priority, eventKind, sourceEntityId, message, "suppressed");
    metrics.recordIntake(priority, IntakeOutcome.SUPPRESSED);
    return IntakeResult.suppressed();
  }

  @VisibleForTesting
  String render(NotificationChannel channel, String message) {
    if (channel != NotificationChannel.SHORT_MESSAGE) {
      return message;
    }
    final int maxLength = routingProperties.shortMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private Instant scheduledFor(NotificationPriority priority, Instant now) {
    return switch (priority) {
      case BATCHED -> deliverySchedule.nextBatchAfter(now);
      case WEEKLY -> deliverySchedule.nextWeeklyAfter(now);
      case IMMEDIATE, SILENT -> null;
    };
  }

  private String serializeContext(
      String eventKind, String sourceEntityId, Map<String, ?> metadata) {
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("event_kind", eventKind);
    context.put("source_entity_id", sourceEntityId);
    context.put("metadata", metadata == null ? Map.of() : metadata);
    try {
      return objectMapper.writeValueAsString(context);
    } catch (JsonProcessingException ex) {
      // メタデータがシリアライズできないのは呼び出し側の入力不備
      throw new NotificationIntakeException("notification context serialization failure", ex);
    }
  }

  private void validate(
      NotificationPriority priority, String message, String eventKind, String sourceEntityId) {
    if (priority == null) {
      throw new NotificationIntakeException("priority is required");
    }
    if (message == null || message.isBlank()) {
      throw new NotificationIntakeException("message must not be blank");
    }
    if (eventKind == null || eventKind.isBlank()) {
      throw new NotificationIntakeException("event_kind must not be blank");
    }
    if (eventKind.length() > EVENT_KIND_MAX_LENGTH) {
      throw new NotificationIntakeException(
          "event_kind must be at most " + EVENT_KIND_MAX_LENGTH + " characters");
    }
    if (sourceEntityId != null && sourceEntityId.length() > SOURCE_ENTITY_ID_MAX_LENGTH) {
      throw new NotificationIntakeException(
          "source_entity_id must be at most " + SOURCE_ENTITY_ID_MAX_LENGTH + " characters");
    }
  }
}
