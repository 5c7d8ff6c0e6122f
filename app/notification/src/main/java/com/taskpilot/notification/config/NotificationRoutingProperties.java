/*
 * どこで: Notification アプリの設定バインド
 * 何を: 優先度ごとの重複抑止窓/配信チャネルと event_kind 単位の上書きを保持する
 * なぜ: 新しい検知器が増えても Router を変更せずにポリシーを調整できるようにするため
 */
package com.taskpilot.notification.config;

import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.routing")
@Validated
public record NotificationRoutingProperties(
    Map<NotificationPriority, Duration> cooldowns,
    Map<String, Duration> cooldownOverrides,
    Map<NotificationPriority, List<NotificationChannel>> channels,
    @NotNull @Positive Integer shortMessageMaxLength) {

  private static final Map<NotificationPriority, Duration> DEFAULT_COOLDOWNS =
      new EnumMap<>(
          Map.of(
              NotificationPriority.IMMEDIATE, Duration.ofHours(4),
              NotificationPriority.BATCHED, Duration.ofHours(8),
              NotificationPriority.WEEKLY, Duration.ofDays(7),
              NotificationPriority.SILENT, Duration.ofHours(1)));

  private static final Map<NotificationPriority, List<NotificationChannel>> DEFAULT_CHANNELS =
      new EnumMap<>(
          Map.of(
              NotificationPriority.IMMEDIATE,
                  List.of(NotificationChannel.PRIMARY_CHAT, NotificationChannel.SHORT_MESSAGE),
              NotificationPriority.BATCHED, List.of(NotificationChannel.PRIMARY_CHAT),
              NotificationPriority.WEEKLY, List.of(NotificationChannel.PRIMARY_CHAT),
              NotificationPriority.SILENT, List.of(NotificationChannel.LOG_ONLY)));

  public NotificationRoutingProperties {
    cooldowns = cooldowns == null ? Map.of() : Map.copyOf(cooldowns);
    cooldownOverrides = cooldownOverrides == null ? Map.of() : Map.copyOf(cooldownOverrides);
    channels = channels == null ? Map.of() : Map.copyOf(channels);
  }

  /** event_kind の上書きがあればそれを、無ければ優先度の既定窓を返す。 */
  public Duration cooldownFor(NotificationPriority priority, String eventKind) {
    final Duration override = eventKind == null ? null : cooldownOverrides.get(eventKind);
    if (override != null) {
      return override;
    }
    return cooldowns.getOrDefault(priority, DEFAULT_COOLDOWNS.get(priority));
  }

  public List<NotificationChannel> channelsFor(NotificationPriority priority) {
    final List<NotificationChannel> configured = channels.get(priority);
    if (configured == null || configured.isEmpty()) {
      return DEFAULT_CHANNELS.get(priority);
    }
    return List.copyOf(configured);
  }

  /** 保存行の channel 列とバッチ/週次ダイジェストの送信先に使う先頭チャネル。 */
  public NotificationChannel primaryChannel(NotificationPriority priority) {
    return channelsFor(priority).get(0);
  }

  @AssertTrue(message = "notification.routing cooldowns must be positive")
  public boolean isCooldownsPositive() {
    return cooldowns.values().stream().allMatch(this::isPositiveDuration)
        && cooldownOverrides.values().stream().allMatch(this::isPositiveDuration);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
