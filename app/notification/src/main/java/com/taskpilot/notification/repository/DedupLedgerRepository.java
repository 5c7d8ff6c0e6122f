/*
 * どこで: Notification データアクセス
 * 何を: dedup_ledger の参照と条件付き upsert を担う
 * なぜ: 重複判定と記録を 1 文で行い、同時受付による二重通知を防ぐため
 */
package com.taskpilot.notification.repository;

import static com.taskpilot.common.JdbcTimestampUtils.toTimestamp;

import com.taskpilot.notification.model.DedupEntry;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DedupLedgerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<DedupEntry> find(String eventKind, String sourceEntityId) {
    // NULL 同士を一致させるため IS NOT DISTINCT FROM で比較する
    final String sql =
        """
        SELECT event_kind, source_entity_id, last_sent_at
        FROM dedup_ledger
        WHERE event_kind = :eventKind
          AND source_entity_id IS NOT DISTINCT FROM CAST(:sourceEntityId AS VARCHAR)
        """;
    final MapSqlParameterSource params = keyParams(eventKind, sourceEntityId);
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new DedupEntry(
                    rs.getString("event_kind"),
                    rs.getString("source_entity_id"),
                    rs.getTimestamp("last_sent_at").toInstant()))
        .stream()
        .findFirst();
  }

  /** 無条件に last_sent_at を更新する。 */
  public void upsert(String eventKind, String sourceEntityId, Instant sentAt) {
    final String sql =
        """
        INSERT INTO dedup_ledger (event_kind, source_entity_id, last_sent_at)
        VALUES (:eventKind, :sourceEntityId, :sentAt)
        ON CONFLICT ON CONSTRAINT uq_dedup_ledger_key
        DO UPDATE SET last_sent_at = EXCLUDED.last_sent_at
        """;
    final MapSqlParameterSource params =
        keyParams(eventKind, sourceEntityId).addValue("sentAt", toTimestamp(sentAt));
    jdbcTemplate.update(sql, params);
  }

  /**
   * 既存行が無いか、last_sent_at が threshold 以前のときだけ sentAt で記録する。
   *
   * @return 記録した場合 true。窓内の既存行があり何も書かなかった場合 false
   */
  public boolean upsertIfExpired(
      String eventKind, String sourceEntityId, Instant sentAt, Instant threshold) {
    // 競合した同一キーは行ロック待ちの後に WHERE を再評価するため、同時に 2 件は通らない
    final String sql =
        """
        INSERT INTO dedup_ledger (event_kind, source_entity_id, last_sent_at)
        VALUES (:eventKind, :sourceEntityId, :sentAt)
        ON CONFLICT ON CONSTRAINT uq_dedup_ledger_key
        DO UPDATE SET last_sent_at = EXCLUDED.last_sent_at
        WHERE dedup_ledger.last_sent_at <= :threshold
        """;
    final MapSqlParameterSource params =
        keyParams(eventKind, sourceEntityId)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params) > 0;
  }

  private MapSqlParameterSource keyParams(String eventKind, String sourceEntityId) {
    return new MapSqlParameterSource()
        .addValue("eventKind", eventKind)
        .addValue("sourceEntityId", sourceEntityId, Types.VARCHAR);
  }
}
