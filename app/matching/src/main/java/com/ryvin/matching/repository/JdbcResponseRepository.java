package com.ryvin.matching.repository;

import static com.ryvin.common.JdbcTimestampUtils.toTimestamp;

import com.ryvin.matching.model.UserResponses;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcResponseRepository implements ResponseRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public UserResponses findByUserId(String userId) {
    return findByUserIds(List.of(userId)).get(userId);
  }

  @Override
  public Map<String, UserResponses> findByUserIds(Collection<String> userIds) {
    final Map<String, Map<String, String>> answersByUser = new HashMap<>();
    for (String userId : userIds) {
      answersByUser.put(userId, new TreeMap<>());
    }
    if (!userIds.isEmpty()) {
      final String sql =
          """
          SELECT user_id, field_id, answer_value
          FROM questionnaire_responses
          WHERE user_id IN (:userIds)
          """;
      final MapSqlParameterSource params =
          new MapSqlParameterSource().addValue("userIds", userIds);
      jdbcTemplate.query(
          sql,
          params,
          rs -> {
            answersByUser
                .computeIfAbsent(rs.getString("user_id"), key -> new TreeMap<>())
                .put(rs.getString("field_id"), rs.getString("answer_value"));
          });
    }
    final Map<String, UserResponses> result = new LinkedHashMap<>();
    answersByUser.forEach(
        (userId, answers) -> result.put(userId, new UserResponses(userId, answers)));
    return result;
  }

  @Override
  public void upsertAll(String userId, Map<String, String> answers, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO questionnaire_responses (user_id, field_id, answer_value, updated_at)
        VALUES (:userId, :fieldId, :answerValue, :updatedAt)
        ON CONFLICT (user_id, field_id)
        DO UPDATE SET
          answer_value = EXCLUDED.answer_value,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource[] batch =
        answers.entrySet().stream()
            .map(
                entry ->
                    new MapSqlParameterSource()
                        .addValue("userId", userId)
                        .addValue("fieldId", entry.getKey())
                        .addValue("answerValue", entry.getValue())
                        .addValue("updatedAt", toTimestamp(updatedAt)))
            .toArray(MapSqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }
}
