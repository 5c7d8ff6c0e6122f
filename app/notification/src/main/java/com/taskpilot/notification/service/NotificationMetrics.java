/*
 * どこで: Notification サービス層
 * 何を: 受付結果/チャネル送信結果/ダイジェスト送信件数/未送信残数のメトリクスを記録する
 * なぜ: 抑止率や送信失敗を Prometheus から直接観測できるようにするため
 */
package com.taskpilot.notification.service;

import com.taskpilot.notification.model.IntakeOutcome;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_INTAKE_TOTAL = "notification.intake.total";
  private static final String METRIC_CHANNEL_SEND_TOTAL = "notification.channel.send.total";
  private static final String METRIC_DIGEST_ITEMS_TOTAL = "notification.digest.items.total";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending notifications")
        .register(meterRegistry);
  }

  public void recordIntake(NotificationPriority priority, IntakeOutcome outcome) {
    counter(
            METRIC_INTAKE_TOTAL,
            "Notification intake outcomes",
            Tags.of("priority", tagValue(priority), "outcome", tagValue(outcome)))
        .increment();
  }

  public void recordChannelSend(NotificationChannel channel, boolean success) {
    counter(
            METRIC_CHANNEL_SEND_TOTAL,
            "Channel adapter send results",
            Tags.of("channel", tagValue(channel), "result", success ? "success" : "failure"))
        .increment();
  }

  public void recordDigestItemsSent(NotificationPriority tier, int count) {
    if (count <= 0) {
      return;
    }
    counter(
            METRIC_DIGEST_ITEMS_TOTAL,
            "Notifications marked sent by digest runs",
            Tags.of("tier", tagValue(tier)))
        .increment(count);
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }

  private String tagValue(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
