package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.service.JourneyCommandResult;

/** outcome が ALREADY_APPLIED の場合、要求の意図は既に達成されており書き込みは行っていない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JourneyCommandResponse(String outcome, JourneyResponse journey) {

  public static JourneyCommandResponse from(JourneyCommandResult result) {
    return new JourneyCommandResponse(
        result.outcome().name(), JourneyResponse.from(result.journey()));
  }
}
