/*
 * どこで: Notification アプリの設定バインド
 * 何を: バッチ時刻リスト/週次の曜日と時刻/タイムゾーンを文字列のまま保持する
 * なぜ: 不正値で起動や受付を失敗させず、DeliverySchedule 側で安全な既定値へ倒すため
 */
package com.taskpilot.notification.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.schedule")
public record NotificationScheduleProperties(
    String zone,
    List<String> batchTimes,
    String weeklyDay,
    String weeklyTime,
    String fallbackTime) {

  public NotificationScheduleProperties {
    batchTimes = batchTimes == null ? List.of() : List.copyOf(batchTimes);
  }
}
