/*
 * どこで: Notification デバッグ API
 * 何を: 未送信通知の一覧・重複判定の確認・バッチ/週次処理の手動起動を提供する
 * なぜ: 動作確認と開発時の可視化のため
 */
package com.taskpilot.notification.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import com.taskpilot.notification.repository.NotificationRepository;
import com.taskpilot.notification.service.BatchDigestProcessor;
import com.taskpilot.notification.service.DedupLedger;
import com.taskpilot.notification.service.WeeklyDigestProcessor;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

    private static final int PENDING_LIMIT = 200;

    private final NotificationRepository notificationRepository;
    private final DedupLedger dedupLedger;
    private final BatchDigestProcessor batchDigestProcessor;
    private final WeeklyDigestProcessor weeklyDigestProcessor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @GetMapping("/pending")
    public PendingNotificationsResponse pending() {
        List<NotificationSummary> items = notificationRepository.findPending(PENDING_LIMIT).stream()
                .map(this::toSummary)
                .toList();
        return new PendingNotificationsResponse(items.size(), items);
    }

    @GetMapping("/dedup")
    public Map<String, Object> dedup(
            @RequestParam("priority") NotificationPriority priority,
            @RequestParam("event_kind") String eventKind,
            @RequestParam(name = "source_entity_id", required = false) String sourceEntityId) {
        boolean duplicate = dedupLedger.isDuplicate(priority, eventKind, sourceEntityId);
        return Map.of("duplicate", duplicate);
    }

    @PostMapping("/batch/run")
    public DigestRunResponse runBatch() {
        Instant now = Instant.now(clock);
        int sentCount = batchDigestProcessor.runBatch(now);
        return new DigestRunResponse(now, sentCount, sentCount > 0);
    }

    @PostMapping("/weekly/run")
    public DigestRunResponse runWeekly() {
        Instant now = Instant.now(clock);
        boolean sent = weeklyDigestProcessor.runWeekly(now);
        return new DigestRunResponse(now, sent ? 1 : 0, sent);
    }

    private NotificationSummary toSummary(NotificationRecord record) {
        try {
            JsonNode context = objectMapper.readTree(record.contextJson());
            return new NotificationSummary(
                    record.notificationId(),
                    record.priority(),
                    record.channel(),
                    record.message(),
                    record.scheduledFor(),
                    record.createdAt(),
                    context);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("notification context parse failure", ex);
        }
    }
}
