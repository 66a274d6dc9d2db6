/*
 * どこで: Matching ドメインモデル
 * 何を: 2 ユーザー間の互換性スコアと内訳を保持する
 * なぜ: スコアの根拠 (カテゴリ別内訳/共通回答数) を説明可能な形で返すため
 */
package com.ryvin.matching.model;

import java.util.List;

/**
 * 互換性スコア。ユーザー id を含めないため、score(A,B) と score(B,A) は equals で比較できる。
 *
 * <p>{@code insufficientData} は共通回答項目が 0 件のときだけ true で、その場合 overall は 0。
 */
public record CompatibilityScore(
    double overall,
    boolean insufficientData,
    List<CategoryScore> categories,
    int mutualFieldCount,
    double coverage,
    boolean dealBreakerFailed,
    List<String> failedDealBreakers,
    long catalogVersion) {

  public CompatibilityScore {
    categories = categories == null ? List.of() : List.copyOf(categories);
    failedDealBreakers = failedDealBreakers == null ? List.of() : List.copyOf(failedDealBreakers);
  }

  public static CompatibilityScore insufficient(long catalogVersion) {
    return new CompatibilityScore(0.0, true, List.of(), 0, 0.0, false, List.of(), catalogVersion);
  }
}
