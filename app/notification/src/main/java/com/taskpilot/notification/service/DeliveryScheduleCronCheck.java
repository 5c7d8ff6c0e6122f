/*
 * どこで: Notification 配信ワーカー
 * 何を: 起動時に配信時刻設定とワーカーの cron が揃っているかを確認する
 * なぜ: 片方だけ変更されると、予約した通知が次の起動まで送られず滞留するため
 */
package com.taskpilot.notification.service;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryScheduleCronCheck {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryScheduleCronCheck.class);
  // バッチは 1 週間分程度、週次は 4 週分を見れば曜日・時刻のずれは検出できる
  static final int BATCH_SAMPLES = 21;
  static final int WEEKLY_SAMPLES = 4;

  private final DeliverySchedule deliverySchedule;
  private final Clock clock;

  @Value("${notification.batch.enabled:true}")
  private boolean batchEnabled;

  @Value("${notification.batch.cron:}")
  private String batchCron;

  @Value("${notification.weekly.enabled:true}")
  private boolean weeklyEnabled;

  @Value("${notification.weekly.cron:}")
  private String weeklyCron;

  @EventListener(ApplicationReadyEvent.class)
  public void verify() {
    final Instant now = Instant.now(clock);
    if (batchEnabled && CronExpression.isValidExpression(batchCron)) {
      deliverySchedule
          .firstBatchSlotMissedBy(CronExpression.parse(batchCron), now, BATCH_SAMPLES)
          .ifPresent(
              slot ->
                  logger.warn(
                      "notification.batch.cron does not fire at batch slot {}; keep it aligned with"
                          + " notification.schedule.batch-times cron={}",
                      slot,
                      batchCron));
    }
    if (weeklyEnabled && CronExpression.isValidExpression(weeklyCron)) {
      deliverySchedule
          .firstWeeklySlotMissedBy(CronExpression.parse(weeklyCron), now, WEEKLY_SAMPLES)
          .ifPresent(
              slot ->
                  logger.warn(
                      "notification.weekly.cron does not fire at weekly slot {}; keep it aligned"
                          + " with notification.schedule.weekly-day/weekly-time cron={}",
                      slot,
                      weeklyCron));
    }
  }
}
