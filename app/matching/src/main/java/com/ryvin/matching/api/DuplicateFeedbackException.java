package com.ryvin.matching.api;

public class DuplicateFeedbackException extends RuntimeException {

  public DuplicateFeedbackException(String meetingId, String submittedBy) {
    super("feedback already submitted meetingId=" + meetingId + " submittedBy=" + submittedBy);
  }
}
