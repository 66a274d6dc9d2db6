/*
 * どこで: Matching スコアリング
 * 何を: 質問項目定義 (特に選択肢の類似度表) を検証する
 * なぜ: 不正な類似度表で非対称/範囲外のスコアが出ることを登録時と読み込み時に防ぐため
 */
package com.ryvin.matching.scoring;

import com.ryvin.matching.model.AnswerKind;
import com.ryvin.matching.model.ComparisonRule;
import com.ryvin.matching.model.QuestionnaireField;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public final class CatalogValidator {

  private static final Pattern FIELD_ID = Pattern.compile("[a-z0-9][a-z0-9_.-]{0,63}");

  private CatalogValidator() {}

  /**
   * 役割: 質問項目定義の不備を 1 件返す。
   * 動作: 問題が無ければ空を返す。メッセージはそのまま API の ValidationError に使える形にする。
   * 前提: field は null でない。
   */
  public static Optional<String> findProblem(QuestionnaireField field) {
    if (field.id() == null || !FIELD_ID.matcher(field.id()).matches()) {
      return Optional.of("field id must match " + FIELD_ID.pattern());
    }
    if (field.category() == null || field.category().isBlank()) {
      return Optional.of("category is required field=" + field.id());
    }
    if (!Double.isFinite(field.weight()) || field.weight() <= 0) {
      return Optional.of("weight must be a positive number field=" + field.id());
    }
    if (field.answerKind() == null || field.comparisonRule() == null) {
      return Optional.of("answer_kind and comparison_rule are required field=" + field.id());
    }
    if (field.answerKind() == AnswerKind.SCALE) {
      return checkScale(field);
    }
    return checkChoice(field);
  }

  public static void requireValid(QuestionnaireField field) {
    findProblem(field)
        .ifPresent(
            problem -> {
              throw new IllegalStateException("invalid questionnaire field: " + problem);
            });
  }

  private static Optional<String> checkScale(QuestionnaireField field) {
    if (field.scaleMin() == null || field.scaleMax() == null) {
      return Optional.of("scale_min and scale_max are required field=" + field.id());
    }
    if (!Double.isFinite(field.scaleMin())
        || !Double.isFinite(field.scaleMax())
        || field.scaleMin() >= field.scaleMax()) {
      return Optional.of("scale_min must be lower than scale_max field=" + field.id());
    }
    if (!field.options().isEmpty() || !field.compatibilityTable().isEmpty()) {
      return Optional.of("scale field cannot declare options field=" + field.id());
    }
    return Optional.empty();
  }

  private static Optional<String> checkChoice(QuestionnaireField field) {
    if (field.scaleMin() != null || field.scaleMax() != null) {
      return Optional.of("only scale fields declare a range field=" + field.id());
    }
    final List<String> options = field.effectiveOptions();
    if (field.answerKind() == AnswerKind.SINGLE_CHOICE) {
      if (options.size() < 2) {
        return Optional.of("single_choice needs at least two options field=" + field.id());
      }
      if (new HashSet<>(options).size() != options.size()
          || options.stream().anyMatch(option -> option == null || option.isBlank())) {
        return Optional.of("options must be distinct and non-blank field=" + field.id());
      }
    } else if (!field.options().isEmpty()) {
      return Optional.of("boolean field cannot declare options field=" + field.id());
    }
    final Map<String, Map<String, Double>> table = field.compatibilityTable();
    if (field.comparisonRule() == ComparisonRule.EXACT_MATCH) {
      return table.isEmpty()
          ? Optional.empty()
          : Optional.of("exact_match cannot declare a compatibility table field=" + field.id());
    }
    if (table.isEmpty()) {
      return Optional.of("similarity rule requires a compatibility table field=" + field.id());
    }
    return checkTable(field.id(), Set.copyOf(options), table);
  }

  private static Optional<String> checkTable(
      String fieldId, Set<String> options, Map<String, Map<String, Double>> table) {
    for (Map.Entry<String, Map<String, Double>> row : table.entrySet()) {
      if (!options.contains(row.getKey())) {
        return Optional.of("compatibility table refers to unknown option field=" + fieldId);
      }
      for (Map.Entry<String, Double> cell : row.getValue().entrySet()) {
        final String left = row.getKey();
        final String right = cell.getKey();
        final Double value = cell.getValue();
        if (!options.contains(right)) {
          return Optional.of("compatibility table refers to unknown option field=" + fieldId);
        }
        if (value == null || !Double.isFinite(value) || value < 0.0 || value > 1.0) {
          return Optional.of("compatibility values must be within [0,1] field=" + fieldId);
        }
        if (left.equals(right) && value != 1.0) {
          return Optional.of("identical options must have compatibility 1 field=" + fieldId);
        }
        final Double mirrored = table.getOrDefault(right, Map.of()).get(left);
        if (mirrored != null && Double.compare(mirrored, value) != 0) {
          return Optional.of("compatibility table must be symmetric field=" + fieldId);
        }
      }
    }
    return Optional.empty();
  }
}
