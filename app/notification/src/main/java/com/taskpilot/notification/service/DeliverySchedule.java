/*
 * どこで: Notification サービス層
 * 何を: バッチ/週次ティアの scheduled_for を設定のローカル時刻から計算する
 * なぜ: 配信時刻設定の不備で受付が失敗したり通知が失われたりしないよう、既定時刻へ倒すため
 */
package com.taskpilot.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.taskpilot.notification.config.NotificationScheduleProperties;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

@Component
public class DeliverySchedule {

  private static final Logger logger = LoggerFactory.getLogger(DeliverySchedule.class);

  static final LocalTime DEFAULT_FALLBACK_TIME = LocalTime.of(9, 0);
  static final DayOfWeek DEFAULT_WEEKLY_DAY = DayOfWeek.SUNDAY;
  static final LocalTime DEFAULT_WEEKLY_TIME = LocalTime.of(20, 0);

  private final ZoneId zone;
  private final List<LocalTime> batchTimes;
  private final DayOfWeek weeklyDay;
  private final LocalTime weeklyTime;
  private final LocalTime fallbackTime;

  public DeliverySchedule(NotificationScheduleProperties properties) {
    this.zone = parseZone(properties.zone());
    this.batchTimes = parseBatchTimes(properties.batchTimes());
    this.weeklyDay = parseWeeklyDay(properties.weeklyDay());
    this.weeklyTime = parseTime(properties.weeklyTime(), DEFAULT_WEEKLY_TIME, "weekly-time");
    this.fallbackTime =
        parseTime(properties.fallbackTime(), DEFAULT_FALLBACK_TIME, "fallback-time");
  }

  /**
   * now より厳密に後の最初のバッチ時刻。当日の最終枠を過ぎていれば翌日の最初の枠。
   * 有効な枠が 1 つも無ければ翌日の fallback-time。
   */
  public Instant nextBatchAfter(Instant now) {
    final LocalDate today = now.atZone(zone).toLocalDate();
    if (batchTimes.isEmpty()) {
      logger.warn(
          "notification schedule has no valid batch-times; falling back to tomorrow {}",
          fallbackTime);
      return toInstant(today.plusDays(1), fallbackTime);
    }
    for (LocalTime batchTime : batchTimes) {
      final Instant candidate = toInstant(today, batchTime);
      if (candidate.isAfter(now)) {
        return candidate;
      }
    }
    return toInstant(today.plusDays(1), batchTimes.get(0));
  }

  /** now より厳密に後の、設定曜日・時刻の最初の発生。 */
  public Instant nextWeeklyAfter(Instant now) {
    final LocalDate date =
        now.atZone(zone).toLocalDate().with(TemporalAdjusters.nextOrSame(weeklyDay));
    final Instant candidate = toInstant(date, weeklyTime);
    if (candidate.isAfter(now)) {
      return candidate;
    }
    return toInstant(date.plusWeeks(1), weeklyTime);
  }

  /**
   * from 以降の最初の samples 個のバッチ枠のうち、cron が起動しない最初の枠を返す。
   *
   * <p>枠と起動時刻がずれると、その枠に予約した通知は次に cron が起動するまで送られない。
   */
  public Optional<Instant> firstBatchSlotMissedBy(CronExpression cron, Instant from, int samples) {
    return firstSlotMissedBy(cron, from, samples, this::nextBatchAfter);
  }

  public Optional<Instant> firstWeeklySlotMissedBy(CronExpression cron, Instant from, int samples) {
    return firstSlotMissedBy(cron, from, samples, this::nextWeeklyAfter);
  }

  private Optional<Instant> firstSlotMissedBy(
      CronExpression cron, Instant from, int samples, UnaryOperator<Instant> nextSlot) {
    Instant cursor = from;
    for (int i = 0; i < samples; i++) {
      final Instant slot = nextSlot.apply(cursor);
      final ZonedDateTime fire = cron.next(slot.minusSeconds(1).atZone(zone));
      if (fire == null || !fire.toInstant().equals(slot)) {
        return Optional.of(slot);
      }
      cursor = slot;
    }
    return Optional.empty();
  }

  public ZoneId zone() {
    return zone;
  }

  @VisibleForTesting
  List<LocalTime> batchTimes() {
    return batchTimes;
  }

  private Instant toInstant(LocalDate date, LocalTime time) {
    return ZonedDateTime.of(date, time, zone).toInstant();
  }

  private static ZoneId parseZone(String value) {
    if (value == null || value.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException ex) {
      logger.warn("invalid notification.schedule.zone={}; falling back to UTC", value);
      return ZoneOffset.UTC;
    }
  }

  private static List<LocalTime> parseBatchTimes(List<String> values) {
    final List<LocalTime> parsed = new ArrayList<>();
    for (String value : values) {
      if (value == null || value.isBlank()) {
        logger.warn("ignoring blank notification.schedule.batch-times entry");
        continue;
      }
      try {
        parsed.add(LocalTime.parse(value.trim()));
      } catch (DateTimeException ex) {
        logger.warn("ignoring malformed notification.schedule.batch-times entry value={}", value);
      }
    }
    return parsed.stream().distinct().sorted().toList();
  }

  private static DayOfWeek parseWeeklyDay(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_WEEKLY_DAY;
    }
    try {
      return DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      logger.warn(
          "invalid notification.schedule.weekly-day={}; falling back to {}",
          value,
          DEFAULT_WEEKLY_DAY);
      return DEFAULT_WEEKLY_DAY;
    }
  }

  private static LocalTime parseTime(String value, LocalTime defaultTime, String key) {
    if (value == null || value.isBlank()) {
      return defaultTime;
    }
    try {
      return LocalTime.parse(value.trim());
    } catch (DateTimeException ex) {
      logger.warn(
          "invalid notification.schedule.{}={}; falling back to {}", key, value, defaultTime);
      return defaultTime;
    }
  }
}
