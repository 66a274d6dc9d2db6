/*
 * どこで: Matching API レスポンス DTO
 * 何を: 質問項目の定義を返す
 * なぜ: クライアントが回答形式と選択肢をカタログから組み立てられるようにするため
 */
package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.QuestionnaireField;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record QuestionnaireFieldResponse(
    String id,
    String category,
    double weight,
    String answerKind,
    String comparisonRule,
    Double scaleMin,
    Double scaleMax,
    List<String> options,
    Map<String, Map<String, Double>> compatibilityTable,
    boolean required,
    boolean dealBreaker,
    String createdAt,
    String retiredAt) {

  public static QuestionnaireFieldResponse from(QuestionnaireField field) {
    return new QuestionnaireFieldResponse(
        field.id(),
        field.category(),
        field.weight(),
        field.answerKind().value(),
        field.comparisonRule().value(),
        field.scaleMin(),
        field.scaleMax(),
        field.options(),
        field.compatibilityTable(),
        field.required(),
        field.dealBreaker(),
        ResponseTimes.iso(field.createdAt()),
        ResponseTimes.iso(field.retiredAt()));
  }
}
