package com.ryvin.matching.journey;

import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.StageHistoryEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** stage_history からステージごとの滞在時間を求める。同じステージへの再訪は合算する。 */
public final class StageDurations {

  private StageDurations() {}

  public static Map<JourneyStage, Duration> compute(List<StageHistoryEntry> history, Instant now) {
    final Map<JourneyStage, Duration> durations = new EnumMap<>(JourneyStage.class);
    for (int i = 0; i < history.size(); i++) {
      final StageHistoryEntry entry = history.get(i);
      if (entry.stage().terminal()) {
        continue;
      }
      final Instant end = i + 1 < history.size() ? history.get(i + 1).occurredAt() : now;
      final Duration spent = Duration.between(entry.occurredAt(), end);
      durations.merge(entry.stage(), spent.isNegative() ? Duration.ZERO : spent, Duration::plus);
    }
    return durations;
  }
}
