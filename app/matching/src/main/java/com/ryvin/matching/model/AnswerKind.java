/*
 * どこで: Matching ドメインモデル
 * 何を: 質問項目の回答形式を定義する
 * なぜ: 回答値の検証規則と類似度計算を形式ごとに固定するため
 */
package com.ryvin.matching.model;

public enum AnswerKind {
  SCALE("scale"),
  SINGLE_CHOICE("single_choice"),
  BOOLEAN("boolean");

  private final String value;

  AnswerKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static AnswerKind fromValue(String kind) {
    for (AnswerKind answerKind : values()) {
      if (answerKind.value.equalsIgnoreCase(kind) || answerKind.name().equalsIgnoreCase(kind)) {
        return answerKind;
      }
    }
    throw new IllegalArgumentException("unsupported answer_kind: " + kind);
  }
}
