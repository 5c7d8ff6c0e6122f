/*
 * どこで: Notification リポジトリの統合テスト
 * 何を: 到来済み未送信の抽出順序と、送信済み更新のガードを Postgres で検証する
 * なぜ: sent_at が一度決まったら変わらないことと、作成順の取り出しが DB 方言で崩れないことを保証するため
 */
package com.taskpilot.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.taskpilot.notification.AbstractPostgresContainerTest;
import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant BASE_TIME = Instant.parse("2026-10-19T10:00:00Z");
    private static final Duration GAP = Duration.ofMinutes(5);
    private static final String CONTEXT_JSON = "{\"event_kind\":\"task_status\",\"metadata\":{}}";

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    }

    @Test
    void insertAndFindByIdKeepsAllFields() {
        NotificationRecord record = batched("Task 'A': todo -> doing", BASE_TIME, BASE_TIME.plus(GAP));

        notificationRepository.insert(record);

        NotificationRecord loaded = notificationRepository.findById(record.notificationId()).orElseThrow();
        assertThat(loaded.priority()).isEqualTo(NotificationPriority.BATCHED);
        assertThat(loaded.channel()).isEqualTo(NotificationChannel.PRIMARY_CHAT);
        assertThat(loaded.message()).isEqualTo(record.message());
        assertThat(loaded.eventKind()).isEqualTo("task_status");
        assertThat(loaded.sourceEntityId()).isEqualTo("task-1");
        assertThat(loaded.contextJson()).contains("\"event_kind\"");
        assertThat(loaded.scheduledFor()).isEqualTo(record.scheduledFor());
        assertThat(loaded.createdAt()).isEqualTo(BASE_TIME);
        assertThat(loaded.isPending()).isTrue();
    }

    @Test
    void findPendingDueReturnsOnlyDueItemsInCreationOrder() {
        Instant slot = BASE_TIME.plus(Duration.ofHours(3));
        NotificationRecord second = batched("second", BASE_TIME.plus(GAP), slot);
        NotificationRecord first = batched("first", BASE_TIME, slot);
        NotificationRecord later = batched("later", BASE_TIME, slot.plus(Duration.ofHours(4)));
        // 挿入順と作成順を逆にしても作成順で返ることを確認する
        notificationRepository.insert(second);
        notificationRepository.insert(first);
        notificationRepository.insert(later);

        List<NotificationRecord> due =
                notificationRepository.findPendingDue(NotificationPriority.BATCHED, slot);

        assertThat(due).extracting(NotificationRecord::message).containsExactly("first", "second");
    }

    @Test
    void findPendingDueIgnoresOtherPriorities() {
        Instant slot = BASE_TIME.plus(Duration.ofHours(3));
        notificationRepository.insert(batched("batched", BASE_TIME, slot));
        notificationRepository.insert(
                new NotificationRecord(
                        UUID.randomUUID(),
                        NotificationPriority.WEEKLY,
                        NotificationChannel.PRIMARY_CHAT,
                        "weekly",
                        "weekly_report",
                        "2026-W42",
                        CONTEXT_JSON,
                        slot,
                        BASE_TIME,
                        null));

        assertThat(notificationRepository.findPendingDue(NotificationPriority.WEEKLY, slot))
                .extracting(NotificationRecord::message)
                .containsExactly("weekly");
    }

    @Test
    void markSentDoesNotOverwriteExistingSentAt() {
        NotificationRecord record = batched("once", BASE_TIME, BASE_TIME);
        notificationRepository.insert(record);
        Instant firstSentAt = BASE_TIME.plus(GAP);

        int first = notificationRepository.markSent(record.notificationId(), firstSentAt);
        int second = notificationRepository.markSent(record.notificationId(), firstSentAt.plus(GAP));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(notificationRepository.findById(record.notificationId()).orElseThrow().sentAt())
                .isEqualTo(firstSentAt);
    }

    @Test
    void markAllSentUpdatesOnlyPendingRows() {
        NotificationRecord a = batched("a", BASE_TIME, BASE_TIME);
        NotificationRecord b = batched("b", BASE_TIME, BASE_TIME);
        notificationRepository.insert(a);
        notificationRepository.insert(b);
        notificationRepository.markSent(a.notificationId(), BASE_TIME);

        int marked = notificationRepository.markAllSent(
                List.of(a.notificationId(), b.notificationId()), BASE_TIME.plus(GAP));

        assertThat(marked).isEqualTo(1);
        assertThat(notificationRepository.countPending()).isZero();
        assertThat(notificationRepository.findById(a.notificationId()).orElseThrow().sentAt())
                .isEqualTo(BASE_TIME);
    }

    @Test
    void markAllSentWithEmptyIdsIsNoOp() {
        assertThat(notificationRepository.markAllSent(List.of(), BASE_TIME)).isZero();
    }

    private NotificationRecord batched(String message, Instant createdAt, Instant scheduledFor) {
        return new NotificationRecord(
                UUID.randomUUID(),
                NotificationPriority.BATCHED,
                NotificationChannel.PRIMARY_CHAT,
                message,
                "task_status",
                "task-1",
                CONTEXT_JSON,
                scheduledFor,
                createdAt,
                null);
    }
}
