package com.ryvin.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimeConfigTest {

  @Test
  void clockIsUtcAndTruncatedToMicroseconds() {
    final Clock clock = new TimeConfig().clock();

    final Instant now = clock.instant();

    assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    assertThat(now.getNano() % 1_000).isZero();
  }
}
