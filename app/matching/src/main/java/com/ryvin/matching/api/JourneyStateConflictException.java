package com.ryvin.matching.api;

import com.ryvin.matching.model.JourneyStage;

/** 現在のステージと両立しない遷移要求。既に達成済みの要求はこの例外にしない。 */
public class JourneyStateConflictException extends RuntimeException {

  private final String journeyId;
  private final JourneyStage currentStage;

  public JourneyStateConflictException(
      String journeyId, JourneyStage currentStage, String message) {
    super(message);
    this.journeyId = journeyId;
    this.currentStage = currentStage;
  }

  public String journeyId() {
    return journeyId;
  }

  public JourneyStage currentStage() {
    return currentStage;
  }
}
