package com.ryvin.matching.api;

public class MatchingAccessDeniedException extends RuntimeException {

  public MatchingAccessDeniedException(String message) {
    super(message);
  }
}
