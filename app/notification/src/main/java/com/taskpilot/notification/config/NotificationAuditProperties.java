/*
 * どこで: Notification アプリ設定バインド
 * 何を: 監査ログ 1 行の設定を保持する
 * なぜ: 監査ログに残す本文の抜粋長をコード変更なしで調整するため
 */
package com.taskpilot.notification.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.audit")
@Validated
public record NotificationAuditProperties(@Positive int messageMaxLength) {}
