/*
 * どこで: Notification API モデル
 * 何を: 通知受付リクエスト
 * なぜ: 別プロセスの検知器からも同じ受付処理を呼べるようにするため
 */
package com.taskpilot.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.service.NotificationRouter;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IntakeRequest(
    @NotNull NotificationPriority priority,
    @NotBlank String message,
    @NotBlank @Size(max = NotificationRouter.EVENT_KIND_MAX_LENGTH) String eventKind,
    @Size(max = NotificationRouter.SOURCE_ENTITY_ID_MAX_LENGTH) String sourceEntityId,
    Map<String, Object> metadata) {}
