/*
 * どこで: Notification データアクセス
 * 何を: notifications テーブルの登録/取得/送信済み更新を担う
 * なぜ: 受付・バッチ・週次処理が同じ保存形式を共有するため
 */
package com.taskpilot.notification.repository;

import static com.taskpilot.common.JdbcTimestampUtils.toInstant;
import static com.taskpilot.common.JdbcTimestampUtils.toTimestamp;

import com.taskpilot.notification.model.NotificationChannel;
import com.taskpilot.notification.model.NotificationPriority;
import com.taskpilot.notification.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, priority, channel, message, event_kind, source_entity_id,
             context_json::text AS context_json_text, scheduled_for, created_at, sent_at
      FROM notifications
      """;

  // 他用途の advisory lock と衝突しないよう固定の基数にティアの序数を足す
  private static final long DIGEST_RUN_LOCK_BASE = 0x4E4F544946L << 8;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          priority,
          channel,
          message,
          event_kind,
          source_entity_id,
          context_json,
          scheduled_for,
          created_at,
          sent_at
        ) VALUES (
          :notificationId,
          :priority,
          :channel,
          :message,
          :eventKind,
          :sourceEntityId,
          CAST(:contextJson AS JSONB),
          :scheduledFor,
          :createdAt,
          :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("priority", record.priority().name())
            .addValue("channel", record.channel().name())
            .addValue("message", record.message())
            .addValue("eventKind", record.eventKind())
            .addValue("sourceEntityId", record.sourceEntityId())
            .addValue("contextJson", record.contextJson())
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 未送信かつ scheduled_for が到来した行を作成順で返す。 */
  public List<NotificationRecord> findPendingDue(NotificationPriority priority, Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE priority = :priority
              AND sent_at IS NULL
              AND scheduled_for <= :now
            ORDER BY created_at, created_seq
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("priority", priority.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findPending(int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE sent_at IS NULL
            ORDER BY created_at, created_seq
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countPending() {
    final String sql = "SELECT COUNT(*) FROM notifications WHERE sent_at IS NULL";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int markSent(UUID notificationId, Instant sentAt) {
    // sent_at は一度決まったら書き換えない
    final String sql =
        """
        UPDATE notifications
        SET sent_at = :sentAt
        WHERE notification_id = :notificationId
          AND sent_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  /** ダイジェスト構成要素を 1 文で送信済みにする。部分的な更新は起きない。 */
  public int markAllSent(Collection<UUID> notificationIds, Instant sentAt) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE notifications
        SET sent_at = :sentAt
        WHERE notification_id IN (:notificationIds)
          AND sent_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationIds", notificationIds);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 送信されたまま sent_at を書けなかった IMMEDIATE 行を閉じる。
   *
   * <p>IMMEDIATE はどのダイジェストにも選ばれないため、ここで閉じないと未送信件数に残り続ける。
   */
  public int markStaleImmediateSent(Instant createdBefore, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET sent_at = :sentAt
        WHERE priority = 'IMMEDIATE'
          AND sent_at IS NULL
          AND created_at <= :createdBefore
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("createdBefore", toTimestamp(createdBefore));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * ティアごとのダイジェスト実行ロックを現在のトランザクションに対して取得する。
   *
   * <p>トランザクション終了で自動解放される。トランザクション外で呼ぶと即座に解放されるので無意味。
   */
  public boolean tryLockDigestRun(NotificationPriority priority) {
    final Boolean acquired =
        jdbcTemplate.queryForObject(
            "SELECT pg_try_advisory_xact_lock(:lockId)",
            new MapSqlParameterSource().addValue("lockId", digestRunLockId(priority)),
            Boolean.class);
    return Boolean.TRUE.equals(acquired);
  }

  static long digestRunLockId(NotificationPriority priority) {
    return DIGEST_RUN_LOCK_BASE + priority.ordinal();
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        NotificationPriority.valueOf(rs.getString("priority")),
        NotificationChannel.valueOf(rs.getString("channel")),
        rs.getString("message"),
        rs.getString("event_kind"),
        rs.getString("source_entity_id"),
        rs.getString("context_json_text"),
        toInstant(rs.getTimestamp("scheduled_for")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
