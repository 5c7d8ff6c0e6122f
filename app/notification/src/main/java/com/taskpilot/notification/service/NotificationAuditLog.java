/*
 * どこで: Notification サービス層
 * 何を: 受付 1 件ごと (抑止/ログのみを含む) とダイジェスト送信ごとに監査行を書く
 * なぜ: 人に届かなかった通知も後から追跡できるようにするため。読み戻しはしない
 */
package com.taskpilot.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpilot.notification.config.NotificationAuditProperties;
import com.taskpilot.notification.model.NotificationPriority;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationAuditLog {

  /** logback-spring.xml で専用ファイルへ振り分けるロガー名。 */
  public static final String AUDIT_LOGGER_NAME = "notification.audit";

  private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);
  private static final Logger logger = LoggerFactory.getLogger(NotificationAuditLog.class);

  private final ObjectMapper objectMapper;
  private final NotificationAuditProperties properties;
  private final Clock clock;

  public void record(
      NotificationPriority priority,
      String eventKind,
      String sourceEntityId,
      String message,
      String outcome) {
    final AuditEntry entry =
        new AuditEntry(
            Instant.now(clock).toString(),
            priority.name(),
            eventKind,
            sourceEntityId,
            truncate(message),
            outcome);
    try {
      auditLogger.info(objectMapper.writeValueAsString(entry));
    } catch (JsonProcessingException ex) {
      // 監査行の失敗で受付自体は止めない
      logger.error(
          "failed to write notification audit line priority={} eventKind={} outcome={}",
          priority,
          eventKind,
          outcome,
          ex);
    }
  }

  private String truncate(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.messageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record AuditEntry(
      String timestamp,
      String priority,
      String eventKind,
      String sourceEntityId,
      String message,
      String outcome) {}
}
