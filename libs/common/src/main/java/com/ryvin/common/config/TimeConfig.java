/*
 * どこで: Common 共通設定
 * 何を: マイクロ秒単位に丸めた UTC の Clock を DI 可能にする
 * なぜ: 期限計算とスイープで同一の時刻源を使い、TIMESTAMPTZ へ書いた時刻を読み戻しても一致させるため
 */
package com.ryvin.common.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  // PostgreSQL の timestamp 精度はマイクロ秒
  static final Duration TICK = Duration.ofNanos(1_000);

  @Bean
  public Clock clock() {
    return Clock.tick(Clock.systemUTC(), TICK);
  }
}
