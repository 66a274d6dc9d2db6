/*
 * どこで: Matching ドメインモデル
 * 何を: Journey のステージと許可される遷移グラフを定義する
 * なぜ: ステージ遷移の正当性を一箇所の表で判定するため
 */
package com.ryvin.matching.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum JourneyStage {
  PROPOSED(false),
  MUTUAL_MATCH(false),
  GUIDED_CONVERSATION(false),
  MEETING_PROPOSED(false),
  MEETING_CONFIRMED(false),
  POST_MEETING_FEEDBACK(false),
  ONGOING(true),
  DECLINED(true),
  EXPIRED(true);

  private static final Map<JourneyStage, Set<JourneyStage>> GRAPH =
      new EnumMap<>(JourneyStage.class);

  static {
    GRAPH.put(PROPOSED, EnumSet.of(MUTUAL_MATCH));
    GRAPH.put(MUTUAL_MATCH, EnumSet.of(GUIDED_CONVERSATION));
    GRAPH.put(GUIDED_CONVERSATION, EnumSet.of(MEETING_PROPOSED));
    // 会議の辞退/期限切れは再提案のため GUIDED_CONVERSATION へ戻る
    GRAPH.put(MEETING_PROPOSED, EnumSet.of(MEETING_CONFIRMED, GUIDED_CONVERSATION));
    GRAPH.put(MEETING_CONFIRMED, EnumSet.of(POST_MEETING_FEEDBACK));
    GRAPH.put(POST_MEETING_FEEDBACK, EnumSet.of(ONGOING));
    for (JourneyStage stage : values()) {
      if (stage.terminal) {
        GRAPH.put(stage, EnumSet.noneOf(JourneyStage.class));
      } else {
        GRAPH.get(stage).add(DECLINED);
        GRAPH.get(stage).add(EXPIRED);
      }
    }
  }

  private final boolean terminal;

  JourneyStage(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean terminal() {
    return terminal;
  }

  public boolean canTransitionTo(JourneyStage next) {
    return next != null && GRAPH.get(this).contains(next);
  }

  public static JourneyStage fromValue(String value) {
    for (JourneyStage stage : values()) {
      if (stage.name().equalsIgnoreCase(value)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("unsupported stage: " + value);
  }
}
