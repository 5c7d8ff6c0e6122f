/*
 * どこで: Notification サービス層
 * 何を: 優先度ごとの重複抑止窓で「同じ状況を既に伝えたか」を判定・記録する
 * なぜ: 検知器が同じ状況を繰り返し報告しても人への割り込みを 1 回に抑えるため
 */
package com.taskpilot.notification.service;

import com.taskpilot.notification.config.NotificationRoutingProperties;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.repository.DedupLedgerRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DedupLedger {

  private final DedupLedgerRepository repository;
  private final NotificationRoutingProperties routingProperties;
  private final Clock clock;

  /** 窓内 (last_sent_at > now - cooldown) に記録があれば true。書き込みは行わない。 */
  public boolean isDuplicate(
      NotificationPriority priority, String eventKind, String sourceEntityId) {
    final Instant threshold = thresholdAt(priority, eventKind, Instant.now(clock));
    return repository
        .find(eventKind, sourceEntityId)
        .map(entry -> entry.lastSentAt().isAfter(threshold))
        .orElse(false);
  }

  public void record(NotificationPriority priority, String eventKind, String sourceEntityId) {
    repository.upsert(eventKind, sourceEntityId, Instant.now(clock));
  }

  /**
   * 判定と記録を 1 文の条件付き upsert で行う。
   *
   * @return 重複でなく記録できた場合 true。重複の場合は何も書かず false
   */
  public boolean tryRecord(
      NotificationPriority priority, String eventKind, String sourceEntityId, Instant now) {
    return repository.upsertIfExpired(
        eventKind, sourceEntityId, now, thresholdAt(priority, eventKind, now));
  }

  private Instant thresholdAt(NotificationPriority priority, String eventKind, Instant now) {
    return now.minus(routingProperties.cooldownFor(priority, eventKind));
  }
}
