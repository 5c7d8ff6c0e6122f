/*
 * どこで: Notification 送信層
 * 何を: Adapter の例外を成功/失敗の真偽値へ畳み込み、結果をログとメトリクスに残す
 * なぜ: Router/Processor が Adapter 内部のエラー種別に依存しないようにするため
 */
package com.taskpilot.notification.channel;

import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.service.NotificationMetrics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChannelDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDispatcher.class);
  private static final int PAYLOAD_EXCERPT_LENGTH = 80;

  private final ChannelAdapter channelAdapter;
  private final NotificationMetrics metrics;

  /**
   * @return Adapter が例外なく戻った場合 true
   */
  public boolean send(NotificationChannel channel, String renderedText) {
    try {
      channelAdapter.send(channel, renderedText);
      metrics.recordChannelSend(channel, true);
      return true;
    } catch (RuntimeException ex) {
      metrics.recordChannelSend(channel, false);
      logger.warn(
          "channel send failed channel={} payload=\"{}\"",
          channel,
          excerpt(renderedText),
          ex);
      return false;
    }
  }

  private String excerpt(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= PAYLOAD_EXCERPT_LENGTH ? text : text.substring(0, PAYLOAD_EXCERPT_LENGTH);
  }
}
