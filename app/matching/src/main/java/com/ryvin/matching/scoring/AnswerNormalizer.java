/*
 * どこで: Matching スコアリング
 * 何を: 回答値を項目の回答形式に照らして検証し、保存用の正規形へ変換する
 * なぜ: 値域外の回答を書き込み時点で拒否し、採点時の解釈を一意にするため
 */
package com.ryvin.matching.scoring;

import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.model.QuestionnaireField;
import java.math.BigDecimal;
import java.util.Locale;

public final class AnswerNormalizer {

  private AnswerNormalizer() {}

  public static String normalize(QuestionnaireField field, String rawValue) {
    if (rawValue == null || rawValue.isBlank()) {
      throw new ValidationException("answer is required field=" + field.id());
    }
    final String value = rawValue.trim();
    return switch (field.answerKind()) {
      case SCALE -> normalizeScale(field, value);
      case BOOLEAN -> normalizeBoolean(field, value);
      case SINGLE_CHOICE -> normalizeChoice(field, value);
    };
  }

  private static String normalizeScale(QuestionnaireField field, String value) {
    final BigDecimal number;
    try {
      number = new BigDecimal(value);
    } catch (NumberFormatException ex) {
      throw new ValidationException("scale answer must be numeric field=" + field.id());
    }
    final double asDouble = number.doubleValue();
    if (asDouble < field.scaleMin() || asDouble > field.scaleMax()) {
      throw new ValidationException(
          "scale answer out of range ["
              + field.scaleMin()
              + ", "
              + field.scaleMax()
              + "] field="
              + field.id());
    }
    return number.stripTrailingZeros().toPlainString();
  }

  private static String normalizeBoolean(QuestionnaireField field, String value) {
    final String lower = value.toLowerCase(Locale.ROOT);
    if (!lower.equals("true") && !lower.equals("false")) {
      throw new ValidationException("boolean answer must be true or false field=" + field.id());
    }
    return lower;
  }

  private static String normalizeChoice(QuestionnaireField field, String value) {
    if (!field.options().contains(value)) {
      throw new ValidationException("answer is not one of the options field=" + field.id());
    }
    return value;
  }
}
