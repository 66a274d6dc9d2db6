package com.ryvin.matching.model;

public enum Decision {
  ACCEPT,
  DECLINE;

  public static Decision fromValue(String value) {
    for (Decision decision : values()) {
      if (decision.name().equalsIgnoreCase(value)) {
        return decision;
      }
    }
    throw new IllegalArgumentException("unsupported decision: " + value);
  }
}
