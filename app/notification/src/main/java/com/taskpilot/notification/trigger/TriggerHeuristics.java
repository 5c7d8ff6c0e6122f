/*
 * どこで: 通知トリガーの補助関数
 * 何を: 期限までの時間計算と、受信メッセージ/ブロッカー照合のヒューリスティック
 * なぜ: 検知器ごとに同じ時刻計算・文字列照合を重複させないため
 */
package com.taskpilot.notification.trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

public final class TriggerHeuristics {

  static final List<String> RESOLUTION_KEYWORDS =
      List.of("attached", "here is", "completed", "finished", "done", "ready", "sent", "enclosed");
  static final List<String> ESCALATION_KEYWORDS =
      List.of("need more", "additional", "question", "clarify", "missing", "waiting");

  private TriggerHeuristics() {}

  /** 期限までの残り時間 (時間単位、切り捨て)。期限超過や不明は 0。 */
  public static long hoursUntil(Instant dueAt, Instant now) {
    if (dueAt == null || now == null) {
      return 0;
    }
    return Math.max(0, Duration.between(now, dueAt).toHours());
  }

  /**
   * 送信者が待ち相手を含むか、監視パターンが件名/本文に現れれば一致。大文字小文字は無視する。
   */
  public static boolean matchesBlocker(BlockerSnapshot blocker, InboundMessage message) {
    final String waitingOn = lower(blocker.waitingOn());
    final String pattern = lower(blocker.watchPattern());
    if (waitingOn.isEmpty() && pattern.isEmpty()) {
      return false;
    }
    if (!waitingOn.isEmpty() && lower(message.sender()).contains(waitingOn)) {
      return true;
    }
    return !pattern.isEmpty()
        && (lower(message.subject()).contains(pattern) || lower(message.body()).contains(pattern));
  }

  /** 解消キーワードの出現数が進展 (追加依頼) キーワードより多ければ解消とみなす。 */
  public static boolean isResolution(InboundMessage message) {
    final String text = lower(message.subject()) + " " + lower(message.body());
    return countMatches(text, RESOLUTION_KEYWORDS) > countMatches(text, ESCALATION_KEYWORDS);
  }

  private static long countMatches(String text, List<String> keywords) {
    return keywords.stream().filter(text::contains).count();
  }

  private static String lower(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
