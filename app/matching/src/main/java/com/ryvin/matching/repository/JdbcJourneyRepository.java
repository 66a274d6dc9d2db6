/*
 * どこで: Matching データアクセス
 * 何を: journeys / journey_stage_history を読み書きする
 * なぜ: 組の一意性と比較交換による遷移を DB の制約と条件付き UPDATE で保証するため
 */
package com.ryvin.matching.repository;

import static com.ryvin.common.JdbcTimestampUtils.toInstant;
import static com.ryvin.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ryvin.matching.journey.JourneyUpdate;
import com.ryvin.matching.model.ConsentLedger;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.JourneyTrigger;
import com.ryvin.matching.model.StageHistoryEntry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcJourneyRepository implements JourneyRepository {

  private static final TypeReference<Map<JourneyStage, Set<String>>> CONSENT =
      new TypeReference<>() {};

  private static final String COLUMNS =
      """
      journey_id, participant_low, participant_high, initiator, stage, version, consent_json,
      deadline, failed_meeting_attempts, ended_by, end_reason, created_at, updated_at
      """;

  private static final String NON_TERMINAL = "stage NOT IN ('ONGOING', 'DECLINED', 'EXPIRED')";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  @Override
  public Optional<JourneyRecord> insertIfNoActive(JourneyRecord record) {
    // 部分一意インデックスに衝突した場合は挿入せず、空結果を返す
    final String sql =
        """
        INSERT INTO journeys (
          journey_id, participant_low, participant_high, initiator, stage, version, consent_json,
          deadline, failed_meeting_attempts, ended_by, end_reason, created_at, updated_at
        ) VALUES (
          :journeyId, :participantLow, :participantHigh, :initiator, :stage, :version, :consentJson,
          :deadline, :failedMeetingAttempts, NULL, NULL, :createdAt, :updatedAt
        )
        ON CONFLICT (participant_low, participant_high)
          WHERE stage NOT IN ('ONGOING', 'DECLINED', 'EXPIRED')
        DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("journeyId", record.journeyId())
            .addValue("participantLow", record.participantLow())
            .addValue("participantHigh", record.participantHigh())
            .addValue("initiator", record.initiator())
            .addValue("stage", record.stage().name())
            .addValue("version", record.version())
            .addValue("consentJson", jsonColumns.write(record.consent().grants()))
            .addValue("deadline", toTimestamp(record.deadline()))
            .addValue("failedMeetingAttempts", record.failedMeetingAttempts())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<JourneyRecord> findById(String journeyId) {
    final String sql = "SELECT " + COLUMNS + " FROM journeys WHERE journey_id = :journeyId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("journeyId", journeyId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<JourneyRecord> findActiveByPair(String participantLow, String participantHigh) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM journeys WHERE participant_low = :low AND participant_high = :high AND "
            + NON_TERMINAL;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("low", participantLow)
            .addValue("high", participantHigh);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<JourneyRecord> compareAndSet(JourneyUpdate update) {
    // stage と version の両方が期待値のときだけ更新する。競合した側は空結果になる
    final String sql =
        """
        UPDATE journeys
        SET
          stage = :newStage,
          version = version + 1,
          consent_json = :consentJson,
          deadline = :deadline,
          failed_meeting_attempts = :failedMeetingAttempts,
          ended_by = :endedBy,
          end_reason = :endReason,
          updated_at = :updatedAt
        WHERE journey_id = :journeyId
          AND stage = :expectedStage
          AND version = :expectedVersion
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("journeyId", update.journeyId())
            .addValue("expectedStage", update.expectedStage().name())
            .addValue("expectedVersion", update.expectedVersion())
            .addValue("newStage", update.newStage().name())
            .addValue("consentJson", jsonColumns.write(update.consent().grants()))
            .addValue("deadline", toTimestamp(update.deadline()))
            .addValue("failedMeetingAttempts", update.failedMeetingAttempts())
            .addValue("endedBy", update.endedBy())
            .addValue("endReason", update.endReason())
            .addValue("updatedAt", toTimestamp(update.updatedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public void appendHistory(List<StageHistoryEntry> entries) {
    if (entries.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO journey_stage_history (
          journey_id, from_stage, stage, actor, transition_trigger, occurred_at
        ) VALUES (
          :journeyId, :fromStage, :stage, :actor, :trigger, :occurredAt
        )
        """;
    final MapSqlParameterSource[] batch =
        entries.stream()
            .map(
                entry ->
                    new MapSqlParameterSource()
                        .addValue("journeyId", entry.journeyId())
                        .addValue("fromStage", stageName(entry.fromStage()))
                        .addValue("stage", entry.stage().name())
                        .addValue("actor", entry.actor())
                        .addValue("trigger", entry.trigger().name())
                        .addValue("occurredAt", toTimestamp(entry.occurredAt())))
            .toArray(MapSqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  @Override
  public List<StageHistoryEntry> findHistory(String journeyId) {
    final String sql =
        """
        SELECT journey_id, from_stage, stage, actor, transition_trigger, occurred_at
        FROM journey_stage_history
        WHERE journey_id = :journeyId
        ORDER BY history_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("journeyId", journeyId);
    return jdbcTemplate.query(sql, params, this::mapHistoryRow);
  }

  @Override
  public List<JourneyRecord> findByParticipant(String userId, JourneyStage stage) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM journeys")
            .append(" WHERE (participant_low = :userId OR participant_high = :userId)");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    if (stage != null) {
      sql.append(" AND stage = :stage");
      params.addValue("stage", stage.name());
    }
    sql.append(" ORDER BY updated_at DESC, journey_id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  @Override
  public Set<String> findActivePartners(String userId) {
    final String sql =
        """
        SELECT CASE WHEN participant_low = :userId THEN participant_high ELSE participant_low END
          AS partner_id
        FROM journeys
        WHERE (participant_low = :userId OR participant_high = :userId)
          AND stage NOT IN ('ONGOING', 'DECLINED', 'EXPIRED')
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return new LinkedHashSet<>(
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("partner_id")));
  }

  @Override
  public Set<String> findDeclinedPartnersSince(String userId, Instant since) {
    final String sql =
        """
        SELECT CASE WHEN participant_low = :userId THEN participant_high ELSE participant_low END
          AS partner_id
        FROM journeys
        WHERE (participant_low = :userId OR participant_high = :userId)
          AND stage = 'DECLINED'
          AND updated_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("since", toTimestamp(since));
    return new LinkedHashSet<>(
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("partner_id")));
  }

  @Override
  public List<JourneyRecord> findOverdue(Instant now, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM journeys WHERE "
            + NON_TERMINAL
            + " AND deadline <= :now ORDER BY deadline, journey_id LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public void lockForUpdate(String journeyId) {
    final String sql = "SELECT journey_id FROM journeys WHERE journey_id = :journeyId FOR UPDATE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("journeyId", journeyId);
    jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("journey_id"));
  }

  private static String stageName(JourneyStage stage) {
    return stage == null ? null : stage.name();
  }

  private JourneyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JourneyRecord(
        rs.getString("journey_id"),
        rs.getString("participant_low"),
        rs.getString("participant_high"),
        rs.getString("initiator"),
        JourneyStage.valueOf(rs.getString("stage")),
        rs.getLong("version"),
        new ConsentLedger(jsonColumns.read(rs.getString("consent_json"), CONSENT)),
        toInstant(rs.getTimestamp("deadline")),
        rs.getInt("failed_meeting_attempts"),
        rs.getString("ended_by"),
        rs.getString("end_reason"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private StageHistoryEntry mapHistoryRow(ResultSet rs, int rowNum) throws SQLException {
    final String fromStage = rs.getString("from_stage");
    return new StageHistoryEntry(
        rs.getString("journey_id"),
        fromStage == null ? null : JourneyStage.valueOf(fromStage),
        JourneyStage.valueOf(rs.getString("stage")),
        rs.getString("actor"),
        JourneyTrigger.valueOf(rs.getString("transition_trigger")),
        toInstant(rs.getTimestamp("occurred_at")));
  }
}
