/*
 * どこで: Notification 送信層
 * 何を: CI/Test 専用でチャネル送信失敗を注入する Adapter
 * なぜ: 実コード経路を汚さずにダイジェスト送信失敗時の保留継続を E2E で再現するため
 */
package com.taskpilot.notification.channel;

import com.taskpilot.notification.model.NotificationChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.channels.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelAdapter implements ChannelAdapter {

  private final LocalChannelAdapter delegate;

  @Value("${notification.channels.failure-injection.text-marker:}")
  private String textMarker;

  // 空なら全チャネルが対象
  @Value("${notification.channels.failure-injection.channel:}")
  private String channelName;

  @Override
  public void send(NotificationChannel channel, String renderedText) {
    if (shouldInjectFailure(channel, renderedText)) {
      throw new IllegalStateException(
          "channel delivery failure injection matched channel=" + channel);
    }
    delegate.send(channel, renderedText);
  }

  private boolean shouldInjectFailure(NotificationChannel channel, String renderedText) {
    if (textMarker == null || textMarker.isBlank()) {
      return false;
    }
    if (channelName != null && !channelName.isBlank() && !channel.name().equals(channelName)) {
      return false;
    }
    // ダイジェストは見出しが先頭に付くため、前方一致ではなく包含で判定する
    return renderedText.contains(textMarker);
  }
}
