/*
 * どこで: 通知トリガー補助関数のユニットテスト
 * 何を: 残り時間計算とブロッカー照合/解消判定を検証する
 * なぜ: 検知器が誤って即時通知を出したり見逃したりしないようにするため
 */
package com.taskpilot.notification.trigger;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TriggerHeuristicsTest {

  private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

  @Test
  void hoursUntilFloorsAndNeverGoesNegative() {
    assertThat(TriggerHeuristics.hoursUntil(NOW.plus(Duration.ofMinutes(359)), NOW)).isEqualTo(5);
    assertThat(TriggerHeuristics.hoursUntil(NOW.minus(Duration.ofHours(2)), NOW)).isZero();
    assertThat(TriggerHeuristics.hoursUntil(null, NOW)).isZero();
  }

  @Test
  void blockerMatchesSenderCaseInsensitively() {
    final BlockerSnapshot blocker = new BlockerSnapshot("b1", "API keys", "Alice", null);
    final InboundMessage message = new InboundMessage("alice@example.com", "hi", "");

    assertThat(TriggerHeuristics.matchesBlocker(blocker, message)).isTrue();
  }

  @Test
  void blockerMatchesWatchPatternInBody() {
    final BlockerSnapshot blocker = new BlockerSnapshot("b1", "Invoice", null, "INV-2042");
    final InboundMessage message =
        new InboundMessage("billing@example.com", "Re: payment", "Invoice inv-2042 is attached");

    assertThat(TriggerHeuristics.matchesBlocker(blocker, message)).isTrue();
  }

  @Test
  void blockerWithoutCriteriaNeverMatches() {
    final BlockerSnapshot blocker = new BlockerSnapshot("b1", "Vague", "", null);

    assertThat(TriggerHeuristics.matchesBlocker(blocker, new InboundMessage("x", "y", "z")))
        .isFalse();
  }

  @Test
  void resolutionNeedsMoreResolutionThanEscalationKeywords() {
    assertThat(TriggerHeuristics.isResolution(new InboundMessage("a", "Done", "Here is the file, attached")))
        .isTrue();
    assertThat(
            TriggerHeuristics.isResolution(
                new InboundMessage("a", "Question", "We need more details to clarify")))
        .isFalse();
    // 同数なら解消とはみなさない
    assertThat(TriggerHeuristics.isResolution(new InboundMessage("a", "sent", "one question")))
        .isFalse();
  }
}
