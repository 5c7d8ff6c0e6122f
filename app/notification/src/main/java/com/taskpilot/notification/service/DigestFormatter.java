/*
 * どこで: Notification サービス層
 * 何を: バッチ対象の通知を event_kind ごとにまとめた 1 通のダイジェスト本文を組み立てる
 * なぜ: 1 回のバッチ実行で人への割り込みを 1 回に抑えるため
 */
package com.taskpilot.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.taskpilot.notification.model.NotificationRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class DigestFormatter {

  static final String HEADER = "=== Daily Update ===";
  static final String UNKNOWN_KIND = "other";

  /**
   * グループ順は入力中の初出順、グループ内は入力順。入力は作成昇順で渡される前提。
   */
  public String format(List<NotificationRecord> notifications) {
    final Map<String, List<NotificationRecord>> byKind = new LinkedHashMap<>();
    for (NotificationRecord notification : notifications) {
      final String kind =
          notification.eventKind() == null || notification.eventKind().isBlank()
              ? UNKNOWN_KIND
              : notification.eventKind();
      byKind.computeIfAbsent(kind, ignored -> new ArrayList<>()).add(notification);
    }

    final List<String> lines = new ArrayList<>();
    lines.add(HEADER);
    lines.add("");
    byKind.forEach(
        (kind, items) -> {
          lines.add("[" + titleOf(kind) + "]");
          for (NotificationRecord item : items) {
            lines.add("  - " + item.message());
          }
          lines.add("");
        });
    return String.join("\n", lines);
  }

  @VisibleForTesting
  static String titleOf(String eventKind) {
    final String[] words = eventKind.replace('_', ' ').trim().split("\\s+");
    final List<String> titled = new ArrayList<>(words.length);
    for (String word : words) {
      if (word.isEmpty()) {
        continue;
      }
      titled.add(
          word.substring(0, 1).toUpperCase(Locale.ROOT)
              + word.substring(1).toLowerCase(Locale.ROOT));
    }
    return String.join(" ", titled);
  }
}
