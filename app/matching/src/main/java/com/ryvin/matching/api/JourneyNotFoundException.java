package com.ryvin.matching.api;

public class JourneyNotFoundException extends RuntimeException {

  public JourneyNotFoundException(String journeyId) {
    super("journey not found: " + journeyId);
  }
}
