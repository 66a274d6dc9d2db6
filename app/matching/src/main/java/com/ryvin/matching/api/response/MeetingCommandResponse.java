package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.service.MeetingCommandResult;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeetingCommandResponse(
    String outcome, MeetingResponse meeting, JourneyResponse journey) {

  public static MeetingCommandResponse from(MeetingCommandResult result) {
    return new MeetingCommandResponse(
        result.outcome().name(),
        MeetingResponse.from(result.meeting()),
        JourneyResponse.from(result.journey()));
  }
}
