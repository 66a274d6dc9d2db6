package com.ryvin.matching.api;

public class InvalidMeetingStateException extends RuntimeException {

  public InvalidMeetingStateException(String message) {
    super(message);
  }
}
