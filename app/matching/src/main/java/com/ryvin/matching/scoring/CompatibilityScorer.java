/*
 * どこで: Matching スコアリング
 * 何を: 2 ユーザーの回答と質問カタログから互換性スコアを計算する
 * なぜ: 重み付き類似度を純粋関数として計算し、決定的かつ対称な結果を保証するため
 */
package com.ryvin.matching.scoring;

import com.ryvin.matching.model.AnswerKind;
import com.ryvin.matching.model.CategoryScore;
import com.ryvin.matching.model.ComparisonRule;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.model.QuestionnaireCatalog;
import com.ryvin.matching.model.QuestionnaireField;
import com.ryvin.matching.model.UserResponses;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * 重み付き類似度による互換性スコア。
 *
 * <p>overall = Σ(weight × similarity) / Σ(weight) を、双方が回答済みの有効項目だけで計算する。
 * 片方でも未回答の項目は分子・分母の両方から除外する。項目は id 順に走査するため、入力の順序や
 * A/B の入れ替えで結果のビット列は変わらない。
 */
@Component
public class CompatibilityScorer {

  public CompatibilityScore score(
      UserResponses userA, UserResponses userB, QuestionnaireCatalog catalog) {
    final List<QuestionnaireField> activeFields = catalog.activeFields();
    final Map<String, Accumulator> byCategory = new TreeMap<>();
    final Accumulator total = new Accumulator();
    final List<String> failedDealBreakers = new ArrayList<>();

    for (QuestionnaireField field : activeFields) {
      final Optional<String> answerA = userA.answer(field.id());
      final Optional<String> answerB = userB.answer(field.id());
      if (answerA.isEmpty() || answerB.isEmpty()) {
        continue;
      }
      final double similarity = similarity(field, answerA.get(), answerB.get());
      total.add(field.weight(), similarity);
      byCategory.computeIfAbsent(field.category(), key -> new Accumulator())
          .add(field.weight(), similarity);
      if (field.dealBreaker() && similarity == 0.0) {
        failedDealBreakers.add(field.id());
      }
    }

    if (total.fieldCount == 0) {
      return CompatibilityScore.insufficient(catalog.version());
    }
    final List<CategoryScore> categories = new ArrayList<>();
    byCategory.forEach(
        (category, accumulator) ->
            categories.add(
                new CategoryScore(
                    category,
                    accumulator.value(),
                    accumulator.weightTotal,
                    accumulator.fieldCount)));
    final double coverage = (double) total.fieldCount / activeFields.size();
    return new CompatibilityScore(
        total.value(),
        false,
        categories,
        total.fieldCount,
        coverage,
        !failedDealBreakers.isEmpty(),
        failedDealBreakers,
        catalog.version());
  }

  /** 1 項目の類似度 [0,1]。引数の順序を入れ替えても同じ値を返す。 */
  double similarity(QuestionnaireField field, String left, String right) {
    if (field.answerKind() == AnswerKind.SCALE) {
      final double a = Double.parseDouble(left);
      final double b = Double.parseDouble(right);
      if (field.comparisonRule() == ComparisonRule.EXACT_MATCH) {
        return Double.compare(a, b) == 0 ? 1.0 : 0.0;
      }
      final double range = field.scaleMax() - field.scaleMin();
      return clamp(1.0 - Math.abs(a - b) / range);
    }
    if (left.equals(right)) {
      return 1.0;
    }
    if (field.comparisonRule() == ComparisonRule.EXACT_MATCH) {
      return 0.0;
    }
    return lookup(field.compatibilityTable(), left, right)
        .or(() -> lookup(field.compatibilityTable(), right, left))
        .orElse(0.0);
  }

  private static Optional<Double> lookup(
      Map<String, Map<String, Double>> table, String left, String right) {
    return Optional.ofNullable(table.getOrDefault(left, Map.of()).get(right));
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static final class Accumulator {
    private double weightedSum;
    private double weightTotal;
    private int fieldCount;

    void add(double weight, double similarity) {
      weightedSum += weight * similarity;
      weightTotal += weight;
      fieldCount++;
    }

    double value() {
      return clamp(weightedSum / weightTotal);
    }
  }
}
