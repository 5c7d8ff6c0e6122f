/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 重複抑止の窓計算や配信スケジュールをテストで固定時刻に差し替えるため
 */
package com.taskpilot.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // 永続化は常に UTC。ローカル時刻の解釈は配信スケジュール側のゾーン設定で行う
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
