/*
 * どこで: Matching データアクセス
 * 何を: 会議後フィードバックの登録と参照を行う
 * なぜ: 1 会議 1 提出者 1 件の制約を DB の一意制約で保証するため
 */
package com.ryvin.matching.repository;

import static com.ryvin.common.JdbcTimestampUtils.toInstant;
import static com.ryvin.common.JdbcTimestampUtils.toTimestamp;

import com.ryvin.matching.model.FeedbackRecord;
import com.ryvin.matching.model.FeedbackSummary;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcFeedbackRepository implements FeedbackRepository {

  private static final String COLUMNS =
      """
      feedback_id, meeting_id, journey_id, submitted_by, about_user_id, rating, comment,
      wants_to_continue, submitted_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<FeedbackRecord> insertIfAbsent(FeedbackRecord record) {
    final String sql =
        """
        INSERT INTO meeting_feedback (
          feedback_id, meeting_id, journey_id, submitted_by, about_user_id, rating, comment,
          wants_to_continue, submitted_at
        ) VALUES (
          :feedbackId, :meetingId, :journeyId, :submittedBy, :aboutUserId, :rating, :comment,
          :wantsToContinue, :submittedAt
        )
        ON CONFLICT (meeting_id, submitted_by) DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("feedbackId", record.feedbackId())
            .addValue("meetingId", record.meetingId())
            .addValue("journeyId", record.journeyId())
            .addValue("submittedBy", record.submittedBy())
            .addValue("aboutUserId", record.aboutUserId())
            .addValue("rating", record.rating())
            .addValue("comment", record.comment())
            .addValue("wantsToContinue", record.wantsToContinue())
            .addValue("submittedAt", toTimestamp(record.submittedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<FeedbackRecord> findByMeeting(String meetingId) {
    return findBy("meeting_id", meetingId);
  }

  @Override
  public List<FeedbackRecord> findBySubmitter(String userId) {
    return findBy("submitted_by", userId);
  }

  @Override
  public List<FeedbackRecord> findAboutUser(String userId) {
    return findBy("about_user_id", userId);
  }

  @Override
  public FeedbackSummary summarizeAbout(String userId) {
    final String sql =
        """
        SELECT
          COUNT(*) AS feedback_count,
          COALESCE(AVG(rating), 0) AS average_rating,
          COALESCE(AVG(CASE WHEN wants_to_continue THEN 1.0 ELSE 0.0 END), 0) AS continue_ratio
        FROM meeting_feedback
        WHERE about_user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new FeedbackSummary(
                userId,
                rs.getLong("feedback_count"),
                rs.getDouble("average_rating"),
                rs.getDouble("continue_ratio")));
  }

  // column は固定の列名のみを渡す
  private List<FeedbackRecord> findBy(String column, String value) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM meeting_feedback WHERE "
            + column
            + " = :value ORDER BY submitted_at DESC, feedback_id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("value", value);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private FeedbackRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new FeedbackRecord(
        rs.getString("feedback_id"),
        rs.getString("meeting_id"),
        rs.getString("journey_id"),
        rs.getString("submitted_by"),
        rs.getString("about_user_id"),
        rs.getInt("rating"),
        rs.getString("comment"),
        rs.getBoolean("wants_to_continue"),
        toInstant(rs.getTimestamp("submitted_at")));
  }
}
