/*
 * どこで: Notification 配信ワーカー
 * 何を: 設定した時刻にバッチダイジェスト処理を起動する
 * なぜ: 1 日数回の決まった時刻に BATCHED 通知をまとめて届けるため
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
    name = "notification.batch.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class BatchDigestWorker {

  private final BatchDigestProcessor batchDigestProcessor;
  private final Clock clock;

  @Scheduled(cron = "${notification.batch.cron}", zone = "${notification.schedule.zone}")
  public void run() {
    batchDigestProcessor.runBatch(Instant.now(clock));
  }
}
