/*
 * どこで: Matching データアクセス
 * 何を: journey_outbox_events の登録/claim/状態更新/保持期限削除を担う
 * なぜ: 遷移のコミットと通知の送信を分離し、送信先の障害でコマンドを止めないため
 */
package com.ryvin.matching.repository;

import static com.ryvin.common.JdbcTimestampUtils.toTimestamp;

import com.ryvin.matching.model.OutboxEventRecord;
import com.ryvin.matching.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcJourneyOutboxRepository implements JourneyOutboxRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public int insert(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO journey_outbox_events (
          event_id, event_type, aggregate_key, payload, status, attempt_count, next_retry_at,
          created_at
        ) VALUES (
          :eventId, :eventType, :aggregateKey, :payload::jsonb, 'PENDING', 0, NULL, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // 複数インスタンスで同じ行を取り合わないよう SKIP LOCKED で claim する
    final String sql =
        """
        WITH cte AS (
          SELECT event_id
          FROM journey_outbox_events
          WHERE (
            status = 'PENDING'
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          )
          OR (
            status = 'IN_FLIGHT'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE journey_outbox_events e
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            last_error = NULL
        FROM cte
        WHERE e.event_id = cte.event_id
        RETURNING e.event_id, e.event_type, e.aggregate_key, e.payload::text AS payload_text,
          e.attempt_count, e.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    // RETURNING の並びは保証されないため作成順に並べ直す
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .sorted(
            Comparator.comparing(ClaimedRow::createdAt)
                .thenComparing(row -> row.record().eventId()))
        .map(ClaimedRow::record)
        .toList();
  }

  @Override
  public int markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE journey_outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("publishedAt", toTimestamp(publishedAt))
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE journey_outbox_events
        SET attempt_count = :attemptCount,
            status = :status,
            next_retry_at = :nextRetryAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL,
            last_error = :lastError
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptCount", attemptCount)
            .addValue("status", status.name())
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("eventId", eventId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int deletePublishedOlderThan(Instant threshold) {
    // 未送信と FAILED は調査用に残す
    final String sql =
        """
        DELETE FROM journey_outbox_events
        WHERE status = 'PUBLISHED'
          AND published_at <= :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int countFailed() {
    final String sql = "SELECT COUNT(*) FROM journey_outbox_events WHERE status = 'FAILED'";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private ClaimedRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ClaimedRow(
        new OutboxEventRecord(
            UUID.fromString(rs.getString("event_id")),
            rs.getString("event_type"),
            rs.getString("aggregate_key"),
            rs.getString("payload_text"),
            rs.getInt("attempt_count")),
        rs.getTimestamp("created_at").toInstant());
  }

  private record ClaimedRow(OutboxEventRecord record, Instant createdAt) {}
}
