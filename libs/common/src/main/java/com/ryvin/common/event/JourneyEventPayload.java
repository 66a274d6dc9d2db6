/*
 * どこで: common のイベント payload 定義
 * 何を: Journey のステージ遷移通知を共通レコードとして提供する
 * なぜ: 通知側サービスと同一のペイロード形状を共有するため
 */
package com.ryvin.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JourneyEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String journeyId,
    List<String> participants,
    String fromStage,
    String toStage,
    String trigger,
    String actor,
    long version,
    String traceId) {

  public JourneyEventPayload {
    participants = participants == null ? List.of() : List.copyOf(participants);
  }
}
