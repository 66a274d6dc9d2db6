package com.ryvin.matching.service;

import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.StageHistoryEntry;
import java.util.List;

/** コミット対象となったステージ遷移。transitions は stage_history に追記した順。 */
public record JourneyTransitionedEvent(
    JourneyRecord journey, List<StageHistoryEntry> transitions, String traceId) {

  public JourneyTransitionedEvent {
    transitions = transitions == null ? List.of() : List.copyOf(transitions);
  }
}
