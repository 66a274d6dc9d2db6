package com.ryvin.matching.repository;

import static com.ryvin.common.JdbcTimestampUtils.toInstant;
import static com.ryvin.common.JdbcTimestampUtils.toTimestamp;

import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcMeetingRequestRepository implements MeetingRequestRepository {

  private static final String COLUMNS =
      """
      meeting_id, journey_id, proposed_by, proposed_time, location, status, respond_by,
      responded_by, responded_at, completed_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<MeetingRequestRecord> insertIfNoneOpen(MeetingRequestRecord record) {
    final String sql =
        """
        INSERT INTO meeting_requests (
          meeting_id, journey_id, proposed_by, proposed_time, location, status, respond_by,
          responded_by, responded_at, completed_at, created_at
        ) VALUES (
          :meetingId, :journeyId, :proposedBy, :proposedTime, :location, :status, :respondBy,
          NULL, NULL, NULL, :createdAt
        )
        ON CONFLICT (journey_id) WHERE status IN ('PENDING', 'ACCEPTED')
        DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("meetingId", record.meetingId())
            .addValue("journeyId", record.journeyId())
            .addValue("proposedBy", record.proposedBy())
            .addValue("proposedTime", toTimestamp(record.proposedTime()))
            .addValue("location", record.location())
            .addValue("status", record.status().name())
            .addValue("respondBy", toTimestamp(record.respondBy()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<MeetingRequestRecord> findById(String meetingId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM meeting_requests WHERE meeting_id = :meetingId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("meetingId", meetingId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<MeetingRequestRecord> findOpenByJourney(String journeyId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM meeting_requests WHERE journey_id = :journeyId"
            + " AND status IN ('PENDING', 'ACCEPTED')";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("journeyId", journeyId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<MeetingRequestRecord> findByJourney(String journeyId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM meeting_requests WHERE journey_id = :journeyId"
            + " ORDER BY created_at, meeting_id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("journeyId", journeyId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public Optional<MeetingRequestRecord> transition(
      String meetingId, MeetingStatus expected, MeetingStatus next, String actor, Instant at) {
    final boolean response = next == MeetingStatus.ACCEPTED || next == MeetingStatus.DECLINED;
    final String sql =
        """
        UPDATE meeting_requests
        SET
          status = :next,
          responded_by = COALESCE(CAST(:respondedBy AS TEXT), responded_by),
          responded_at = COALESCE(CAST(:respondedAt AS TIMESTAMPTZ), responded_at),
          completed_at = COALESCE(CAST(:completedAt AS TIMESTAMPTZ), completed_at)
        WHERE meeting_id = :meetingId AND status = :expected
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("meetingId", meetingId)
            .addValue("expected", expected.name())
            .addValue("next", next.name())
            .addValue("respondedBy", response ? actor : null)
            .addValue("respondedAt", response ? toTimestamp(at) : null)
            .addValue("completedAt", next == MeetingStatus.COMPLETED ? toTimestamp(at) : null);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private MeetingRequestRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MeetingRequestRecord(
        rs.getString("meeting_id"),
        rs.getString("journey_id"),
        rs.getString("proposed_by"),
        toInstant(rs.getTimestamp("proposed_time")),
        rs.getString("location"),
        MeetingStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("respond_by")),
        rs.getString("responded_by"),
        toInstant(rs.getTimestamp("responded_at")),
        toInstant(rs.getTimestamp("completed_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
