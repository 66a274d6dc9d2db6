/*
 * どこで: Matching ドメインモデル
 * 何を: プロフィールサービスから受け取る候補フィルタ用の属性を保持する
 * なぜ: 年齢/距離/性別の相互条件と認証状態だけを絞り込み入力として扱うため
 */
package com.ryvin.matching.model;

import java.util.Set;

public record UserProfile(
    String userId,
    boolean verified,
    boolean active,
    Integer age,
    String gender,
    Set<String> seekingGenders,
    Integer minAge,
    Integer maxAge,
    Double maxDistanceKm,
    Double latitude,
    Double longitude) {

  public UserProfile {
    seekingGenders = seekingGenders == null ? Set.of() : Set.copyOf(seekingGenders);
  }

  public boolean hasLocation() {
    return latitude != null && longitude != null;
  }
}
