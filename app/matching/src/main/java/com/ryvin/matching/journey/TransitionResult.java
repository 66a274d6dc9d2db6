package com.ryvin.matching.journey;

public record TransitionResult(Kind kind, JourneyUpdate update, String rejection) {

  public enum Kind {
    APPLIED,
    // 要求の意図が既に達成されている。書き込みは不要。
    ALREADY_APPLIED,
    REJECTED
  }

  static TransitionResult applied(JourneyUpdate update) {
    return new TransitionResult(Kind.APPLIED, update, null);
  }

  static TransitionResult alreadyApplied() {
    return new TransitionResult(Kind.ALREADY_APPLIED, null, null);
  }

  static TransitionResult rejected(String rejection) {
    return new TransitionResult(Kind.REJECTED, null, rejection);
  }
}
