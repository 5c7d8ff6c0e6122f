/*
 * どこで: Notification サービス層
 * 何を: ダイジェスト実行後に未送信件数を数え直してゲージへ反映する
 * なぜ: 保存層の障害時にゲージ更新の失敗で実行結果を失わないため
 */
package com.taskpilot.notification.service;

import com.taskpilot.notification.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DigestBacklogReporter {

  private static final Logger logger = LoggerFactory.getLogger(DigestBacklogReporter.class);

  private final NotificationRepository notificationRepository;
  private final NotificationMetrics metrics;

  public void refresh() {
    try {
      metrics.updateBacklogCurrent(notificationRepository.countPending());
    } catch (DataAccessException ex) {
      // ゲージは前回値のまま。次の実行で再計算される
      logger.warn("failed to refresh notification backlog gauge", ex);
    }
  }
}
