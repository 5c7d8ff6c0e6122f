/*
 * どこで: Notification API モデル
 * 何を: 手動起動したバッチ/週次処理の結果
 * なぜ: スケジュールを待たずに動作確認するため
 */
package com.taskpilot.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DigestRunResponse(Instant ranAt, int sentCount, boolean sent) {}
