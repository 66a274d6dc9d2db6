/*
 * どこで: Matching API リクエスト DTO
 * 何を: 質問項目の登録 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.ryvin.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.AnswerKind;
import com.ryvin.matching.model.ComparisonRule;
import com.ryvin.matching.model.QuestionnaireField;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record RegisterFieldRequest(
    @NotBlank(message = "id is required") String id,
    @NotBlank(message = "category is required") String category,
    @NotNull(message = "weight is required") @Positive(message = "weight must be positive")
        Double weight,
    @NotBlank(message = "answer_kind is required") String answerKind,
    String comparisonRule,
    Double scaleMin,
    Double scaleMax,
    List<String> options,
    Map<String, Map<String, Double>> compatibilityTable,
    Boolean required,
    Boolean dealBreaker) {

  /** comparison_rule を省略した場合は exact_match。 */
  public QuestionnaireField toDraft() {
    return new QuestionnaireField(
        id.trim(),
        category.trim(),
        weight,
        AnswerKind.fromValue(answerKind),
        comparisonRule == null || comparisonRule.isBlank()
            ? ComparisonRule.EXACT_MATCH
            : ComparisonRule.fromValue(comparisonRule),
        scaleMin,
        scaleMax,
        options,
        compatibilityTable,
        Boolean.TRUE.equals(required),
        Boolean.TRUE.equals(dealBreaker),
        null,
        null);
  }
}
