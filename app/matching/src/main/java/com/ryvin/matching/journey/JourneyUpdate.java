package com.ryvin.matching.journey;

import com.ryvin.matching.model.ConsentLedger;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.StageHistoryEntry;
import java.time.Instant;
import java.util.List;

/**
 * 比較交換で書き込む内容。{@code expectedStage} と {@code expectedVersion} が一致した場合だけ適用し、
 * 適用時に version を 1 進めて {@code history} を追記する。
 */
public record JourneyUpdate(
    String journeyId,
    JourneyStage expectedStage,
    long expectedVersion,
    JourneyStage newStage,
    ConsentLedger consent,
    Instant deadline,
    int failedMeetingAttempts,
    String endedBy,
    String endReason,
    Instant updatedAt,
    List<StageHistoryEntry> history) {

  public JourneyUpdate {
    history = history == null ? List.of() : List.copyOf(history);
  }
}
