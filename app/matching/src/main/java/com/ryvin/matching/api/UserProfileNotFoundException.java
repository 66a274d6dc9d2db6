package com.ryvin.matching.api;

public class UserProfileNotFoundException extends RuntimeException {

  public UserProfileNotFoundException(String userId) {
    super("user profile not found: " + userId);
  }
}
