/*
 * どこで: Notification 送信層
 * 何を: チャネル送信を模擬する実装
 * なぜ: 外部送信を伴わずに受付からダイジェスト送信までの状態遷移を確認するため
 */
package com.taskpilot.notification.channel;

import com.taskpilot.notification.model.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalChannelAdapter implements ChannelAdapter {

    private static final Logger logger = LoggerFactory.getLogger(LocalChannelAdapter.class);

    @Override
    public void send(NotificationChannel channel, String renderedText) {
        // 実送信は行わず、ログに残すだけとする
        logger.info("channel simulated send channel={} length={}", channel, renderedText.length());
    }
}
