package com.ryvin.matching.api;

public class JourneyAlreadyExistsException extends RuntimeException {

  private final String existingJourneyId;

  public JourneyAlreadyExistsException(String existingJourneyId) {
    super("an active journey already exists for this pair");
    this.existingJourneyId = existingJourneyId;
  }

  public String existingJourneyId() {
    return existingJourneyId;
  }
}
