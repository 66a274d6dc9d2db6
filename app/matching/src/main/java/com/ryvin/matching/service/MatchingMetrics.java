package com.ryvin.matching.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MatchingMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer scoreTimer;
  private final Timer rankTimer;
  private final DistributionSummary candidateCount;
  private final ConcurrentMap<String, Counter> scoreCacheCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> profileErrorCounters = new ConcurrentHashMap<>();

  public MatchingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.scoreTimer =
        Timer.builder("matching.score.duration")
            .description("Time to compute a compatibility score for one pair")
            .register(meterRegistry);
    this.rankTimer =
        Timer.builder("matching.rank.duration")
            .description("Time to rank a candidate pool for one user")
            .register(meterRegistry);
    this.candidateCount =
        DistributionSummary.builder("matching.rank.candidates")
            .description("Number of candidates returned by a ranking request")
            .register(meterRegistry);
  }

  public void recordScoreDuration(Duration duration) {
    scoreTimer.record(duration);
  }

  public void recordRank(Duration duration, int returned) {
    rankTimer.record(duration);
    candidateCount.record(Math.max(0, returned));
  }

  public void recordScoreCache(String result) {
    scoreCacheCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder("matching.score.cache")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordProfileError(String reason) {
    profileErrorCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder("matching.profile.error.total")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }
}
