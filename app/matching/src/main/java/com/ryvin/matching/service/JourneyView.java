package com.ryvin.matching.service;

import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.StageHistoryEntry;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Journey の現在状態と監査履歴。timeInStage は履歴から算出したステージ別の滞在時間。 */
public record JourneyView(
    JourneyRecord journey,
    List<StageHistoryEntry> history,
    Map<JourneyStage, Duration> timeInStage,
    List<MeetingRequestRecord> meetings) {

  public JourneyView {
    history = history == null ? List.of() : List.copyOf(history);
    timeInStage = timeInStage == null ? Map.of() : Map.copyOf(timeInStage);
    meetings = meetings == null ? List.of() : List.copyOf(meetings);
  }
}
