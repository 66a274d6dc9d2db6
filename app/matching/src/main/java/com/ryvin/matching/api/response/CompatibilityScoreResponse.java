/*
 * どこで: Matching API レスポンス DTO
 * 何を: 互換性スコアとカテゴリ別の内訳を返す
 * なぜ: スコアの根拠を利用者に説明できる形で公開するため
 */
package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.CategoryScore;
import com.ryvin.matching.model.CompatibilityScore;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record CompatibilityScoreResponse(
    double overall,
    boolean insufficientData,
    List<Category> categories,
    int mutualFieldCount,
    double coverage,
    boolean dealBreakerFailed,
    List<String> failedDealBreakers,
    long catalogVersion) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Category(String category, double score, double weightTotal, int fieldCount) {

    static Category from(CategoryScore score) {
      return new Category(score.category(), score.score(), score.weightTotal(), score.fieldCount());
    }
  }

  public static CompatibilityScoreResponse from(CompatibilityScore score) {
    return new CompatibilityScoreResponse(
        score.overall(),
        score.insufficientData(),
        score.categories().stream().map(Category::from).toList(),
        score.mutualFieldCount(),
        score.coverage(),
        score.dealBreakerFailed(),
        score.failedDealBreakers(),
        score.catalogVersion());
  }
}
