/*
 * どこで: Matching ドメインモデル
 * 何を: Journey の現在状態 (ステージ/版数/同意/期限) を保持する
 * なぜ: version 付きの比較交換でステージ更新を直列化するため
 */
package com.ryvin.matching.model;

import java.time.Instant;
import java.util.List;

/**
 * 参加者は辞書順で {@code participantLow < participantHigh} に正規化して保持する。
 */
public record JourneyRecord(
    String journeyId,
    String participantLow,
    String participantHigh,
    String initiator,
    JourneyStage stage,
    long version,
    ConsentLedger consent,
    Instant deadline,
    int failedMeetingAttempts,
    String endedBy,
    String endReason,
    Instant createdAt,
    Instant updatedAt) {

  public JourneyRecord {
    consent = consent == null ? ConsentLedger.empty() : consent;
  }

  public List<String> participants() {
    return List.of(participantLow, participantHigh);
  }

  public boolean isParticipant(String userId) {
    return participantLow.equals(userId) || participantHigh.equals(userId);
  }

  /** 相手側の参加者 id。actor が参加者であることは呼び出し側で保証する。 */
  public String counterpartOf(String userId) {
    return participantLow.equals(userId) ? participantHigh : participantLow;
  }
}
