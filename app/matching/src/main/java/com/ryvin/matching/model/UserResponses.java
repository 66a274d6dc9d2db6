package com.ryvin.matching.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** 1 ユーザーの回答一覧。値は書き込み時に正規化済みの文字列で保持する。 */
public record UserResponses(String userId, Map<String, String> answers) {

  public UserResponses {
    answers = answers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(answers));
  }

  public static UserResponses empty(String userId) {
    return new UserResponses(userId, Map.of());
  }

  public Optional<String> answer(String fieldId) {
    return Optional.ofNullable(answers.get(fieldId));
  }
}
