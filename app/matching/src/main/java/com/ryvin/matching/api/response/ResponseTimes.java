package com.ryvin.matching.api.response;

import java.time.Instant;

final class ResponseTimes {

  private ResponseTimes() {}

  static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
