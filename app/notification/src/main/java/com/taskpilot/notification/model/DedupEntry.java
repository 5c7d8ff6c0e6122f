/*
 * どこで: Notification ドメインモデル
 * 何を: dedup_ledger テーブルの 1 行
 * なぜ: 同一状況 (event_kind, source_entity_id) の最終通知時刻を参照するため
 */
package com.taskpilot.notification.model;

import java.time.Instant;

/**
 * sourceEntityId が null の行は event_kind 全体で 1 つの重複抑止キーになる。
 */
public record DedupEntry(String eventKind, String sourceEntityId, Instant lastSentAt) {}
