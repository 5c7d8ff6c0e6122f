/*
 * どこで: Notification 配信ワーカー
 * 何を: 週 1 回の定刻に週次レポート送信を起動する
 * なぜ: WEEKLY 通知を決まった曜日・時刻に届けるため
 */
package com.taskpilot.notification.service;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.weekly.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class WeeklyDigestWorker {

  private final WeeklyDigestProcessor weeklyDigestProcessor;
  private final Clock clock;

  @Scheduled(cron = "${notification.weekly.cron}", zone = "${notification.schedule.zone}")
  public void run() {
    weeklyDigestProcessor.runWeekly(Instant.now(clock));
  }
}
