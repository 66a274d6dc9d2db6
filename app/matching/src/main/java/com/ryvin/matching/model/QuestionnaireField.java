/*
 * どこで: Matching ドメインモデル
 * 何を: 質問項目の定義 (カテゴリ/重み/回答形式/比較規則) を保持する
 * なぜ: 回答が参照した後は不変な参照データとして扱うため
 */
package com.ryvin.matching.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 質問項目の定義。
 *
 * <p>{@code compatibilityTable} は選択肢どうしの類似度表で、SIMILARITY 規則の選択式項目でのみ使う。
 * 表に無い組み合わせは一致なら 1, 不一致なら 0 として扱う。
 */
public record QuestionnaireField(
    String id,
    String category,
    double weight,
    AnswerKind answerKind,
    ComparisonRule comparisonRule,
    Double scaleMin,
    Double scaleMax,
    List<String> options,
    Map<String, Map<String, Double>> compatibilityTable,
    boolean required,
    boolean dealBreaker,
    Instant createdAt,
    Instant retiredAt) {

  public QuestionnaireField {
    options = options == null ? List.of() : List.copyOf(options);
    compatibilityTable = copyTable(compatibilityTable);
  }

  public boolean retired() {
    return retiredAt != null;
  }

  /** BOOLEAN は true/false を暗黙の選択肢として扱う。 */
  public List<String> effectiveOptions() {
    if (answerKind == AnswerKind.BOOLEAN) {
      return List.of("true", "false");
    }
    return options;
  }

  public QuestionnaireField retire(Instant at) {
    return new QuestionnaireField(
        id,
        category,
        weight,
        answerKind,
        comparisonRule,
        scaleMin,
        scaleMax,
        options,
        compatibilityTable,
        required,
        dealBreaker,
        createdAt,
        at);
  }

  private static Map<String, Map<String, Double>> copyTable(
      Map<String, Map<String, Double>> table) {
    if (table == null || table.isEmpty()) {
      return Map.of();
    }
    final Map<String, Map<String, Double>> copy = new TreeMap<>();
    table.forEach(
        (left, row) ->
            copy.put(
                left,
                row == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(row))));
    return Collections.unmodifiableMap(copy);
  }
}
