/*
 * どこで: Notification 受付 API
 * 何を: HTTP 経由の通知受付を Router へ委譲する
 * なぜ: 受信メッセージ分類器など別プロセスの検知器から通知を送れるようにするため
 */
package com.taskpilot.notification.api;

import com.taskpilot.notification.service.NotificationRouter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationIntakeController {

  private final NotificationRouter router;

  @PostMapping("/intake")
  public IntakeResponse intake(@Valid @RequestBody IntakeRequest request) {
    return IntakeResponse.from(
        router.intake(
            request.priority(),
            request.message(),
            request.eventKind(),
            request.sourceEntityId(),
            request.metadata()));
  }
}
