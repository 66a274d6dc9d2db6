package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.StageHistoryEntry;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageHistoryResponse(
    String fromStage, String stage, String actor, String trigger, String occurredAt) {

  public static StageHistoryResponse from(StageHistoryEntry entry) {
    return new StageHistoryResponse(
        entry.fromStage() == null ? null : entry.fromStage().name(),
        entry.stage().name(),
        entry.actor(),
        entry.trigger().name(),
        ResponseTimes.iso(entry.occurredAt()));
  }
}
