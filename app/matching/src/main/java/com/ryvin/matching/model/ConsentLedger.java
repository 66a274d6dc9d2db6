/*
 * どこで: Matching ドメインモデル
 * 何を: ステージごとの参加者同意フラグを保持する
 * なぜ: 同時承認の競合時に「この参加者の同意は既に成立済みか」を判定するため
 */
package com.ryvin.matching.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public record ConsentLedger(Map<JourneyStage, Set<String>> grants) {

  public ConsentLedger {
    final Map<JourneyStage, Set<String>> copy = new EnumMap<>(JourneyStage.class);
    if (grants != null) {
      grants.forEach(
          (stage, users) ->
              copy.put(
                  stage,
                  Collections.unmodifiableSet(new TreeSet<>(users == null ? Set.of() : users))));
    }
    grants = Collections.unmodifiableMap(copy);
  }

  public static ConsentLedger empty() {
    return new ConsentLedger(Map.of());
  }

  public boolean granted(JourneyStage stage, String userId) {
    return grants.getOrDefault(stage, Set.of()).contains(userId);
  }

  public boolean grantedByAll(JourneyStage stage, Collection<String> userIds) {
    return grants.getOrDefault(stage, Set.of()).containsAll(userIds);
  }

  /** 新しい台帳を返す。既に同意済みなら同じ内容になる。 */
  public ConsentLedger grant(JourneyStage stage, String userId) {
    final Map<JourneyStage, Set<String>> next = new EnumMap<>(JourneyStage.class);
    next.putAll(grants);
    final Set<String> users = new TreeSet<>(grants.getOrDefault(stage, Set.of()));
    users.add(userId);
    next.put(stage, users);
    return new ConsentLedger(next);
  }
}
