package com.ryvin.matching.api;

public class MeetingRequestNotFoundException extends RuntimeException {

  public MeetingRequestNotFoundException(String meetingId) {
    super("meeting request not found: " + meetingId);
  }
}
