/*
 * どこで: Matching データアクセス
 * 何を: 質問カタログ (項目定義と catalog_version) を読み書きする
 * なぜ: カタログ変更とバージョン更新を同じ DB で一貫させるため
 */
package com.ryvin.matching.repository;

import static com.ryvin.common.JdbcTimestampUtils.toInstant;
import static com.ryvin.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ryvin.matching.model.AnswerKind;
import com.ryvin.matching.model.ComparisonRule;
import com.ryvin.matching.model.QuestionnaireField;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcQuestionnaireRepository implements QuestionnaireRepository {

  private static final TypeReference<List<String>> OPTIONS = new TypeReference<>() {};
  private static final TypeReference<Map<String, Map<String, Double>>> TABLE =
      new TypeReference<>() {};

  private static final String FIELD_COLUMNS =
      """
      field_id, category, weight, answer_kind, comparison_rule, scale_min, scale_max,
      options_json, compatibility_json, required, deal_breaker, created_at, retired_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  @Override
  public long currentVersion() {
    final Long version =
        jdbcTemplate.queryForObject(
            "SELECT version FROM questionnaire_catalog WHERE catalog_id = 1",
            new MapSqlParameterSource(),
            Long.class);
    return version == null ? 0L : version;
  }

  @Override
  public List<QuestionnaireField> findAllFields() {
    final String sql = "SELECT " + FIELD_COLUMNS + " FROM questionnaire_fields ORDER BY field_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  @Override
  public Optional<QuestionnaireField> findField(String fieldId) {
    final String sql =
        "SELECT " + FIELD_COLUMNS + " FROM questionnaire_fields WHERE field_id = :fieldId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("fieldId", fieldId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public boolean insertField(QuestionnaireField field) {
    final String sql =
        """
        INSERT INTO questionnaire_fields (
          field_id, category, weight, answer_kind, comparison_rule, scale_min, scale_max,
          options_json, compatibility_json, required, deal_breaker, created_at, retired_at
        ) VALUES (
          :fieldId, :category, :weight, :answerKind, :comparisonRule, :scaleMin, :scaleMax,
          :optionsJson, :compatibilityJson, :required, :dealBreaker, :createdAt, NULL
        )
        ON CONFLICT (field_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("fieldId", field.id())
            .addValue("category", field.category())
            .addValue("weight", field.weight())
            .addValue("answerKind", field.answerKind().name())
            .addValue("comparisonRule", field.comparisonRule().name())
            .addValue("scaleMin", field.scaleMin())
            .addValue("scaleMax", field.scaleMax())
            .addValue("optionsJson", jsonColumns.write(field.options()))
            .addValue("compatibilityJson", jsonColumns.write(field.compatibilityTable()))
            .addValue("required", field.required())
            .addValue("dealBreaker", field.dealBreaker())
            .addValue("createdAt", toTimestamp(field.createdAt()));
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public Optional<QuestionnaireField> retireField(String fieldId, Instant retiredAt) {
    final String sql =
        """
        UPDATE questionnaire_fields
        SET retired_at = :retiredAt
        WHERE field_id = :fieldId AND retired_at IS NULL
        RETURNING
        """
            + FIELD_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("fieldId", fieldId)
            .addValue("retiredAt", toTimestamp(retiredAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public long bumpVersion(Instant updatedAt) {
    final String sql =
        """
        UPDATE questionnaire_catalog
        SET version = version + 1, updated_at = :updatedAt
        WHERE catalog_id = 1
        RETURNING version
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("updatedAt", toTimestamp(updatedAt));
    final Long version = jdbcTemplate.queryForObject(sql, params, Long.class);
    return version == null ? 0L : version;
  }

  private QuestionnaireField mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new QuestionnaireField(
        rs.getString("field_id"),
        rs.getString("category"),
        rs.getDouble("weight"),
        AnswerKind.valueOf(rs.getString("answer_kind")),
        ComparisonRule.valueOf(rs.getString("comparison_rule")),
        rs.getObject("scale_min", Double.class),
        rs.getObject("scale_max", Double.class),
        jsonColumns.read(rs.getString("options_json"), OPTIONS),
        jsonColumns.read(rs.getString("compatibility_json"), TABLE),
        rs.getBoolean("required"),
        rs.getBoolean("deal_breaker"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("retired_at")));
  }
}
