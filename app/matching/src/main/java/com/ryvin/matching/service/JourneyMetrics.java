/*
 * どこで: Matching サービス層
 * 何を: Journey 遷移と比較交換の競合、期限スイープ、通知 outbox のメトリクスを記録する
 * なぜ: 遷移の偏りや競合の頻度を Prometheus から直接観測できるようにするため
 */
package com.ryvin.matching.service;

import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.JourneyTrigger;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JourneyMetrics {

  private static final String METRIC_TRANSITION_TOTAL = "journey.transition.total";
  private static final String METRIC_CAS_CONFLICT_TOTAL = "journey.cas.conflict.total";
  private static final String METRIC_SWEEP_PROCESSED_TOTAL = "journey.sweep.processed.total";
  private static final String METRIC_NOTIFICATION_ERROR_TOTAL =
      "journey.notification.error.total";
  private static final String METRIC_FEEDBACK_SUBMITTED_TOTAL = "feedback.submitted.total";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "journey.outbox.publish.delay";
  private static final String METRIC_OUTBOX_FAILED_CURRENT = "journey.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final Counter casConflictCounter;
  private final Counter notificationErrorCounter;
  private final Counter feedbackSubmittedCounter;
  private final Timer outboxPublishDelayTimer;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sweepCounters = new ConcurrentHashMap<>();

  public JourneyMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.casConflictCounter =
        Counter.builder(METRIC_CAS_CONFLICT_TOTAL)
            .description("Journey updates that lost a compare-and-swap race")
            .register(meterRegistry);
    this.notificationErrorCounter =
        Counter.builder(METRIC_NOTIFICATION_ERROR_TOTAL)
            .description("Stage transition signals that could not be delivered")
            .register(meterRegistry);
    this.feedbackSubmittedCounter =
        Counter.builder(METRIC_FEEDBACK_SUBMITTED_TOTAL)
            .description("Accepted post-meeting feedback submissions")
            .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from stage transition to outbox publish completion")
            .register(meterRegistry);
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED journey outbox events")
        .register(meterRegistry);
  }

  public void recordTransition(JourneyStage from, JourneyStage to, JourneyTrigger trigger) {
    final String fromTag = from == null ? "none" : from.name();
    final String key = fromTag + "|" + to.name() + "|" + trigger.name();
    transitionCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_TRANSITION_TOTAL)
                    .tags(Tags.of("from", fromTag, "to", to.name(), "trigger", trigger.name()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCasConflict() {
    casConflictCounter.increment();
  }

  public void recordSweepResult(String result) {
    sweepCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_SWEEP_PROCESSED_TOTAL)
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordNotificationError() {
    notificationErrorCounter.increment();
  }

  public void recordFeedbackSubmitted() {
    feedbackSubmittedCounter.increment();
  }

  public void recordOutboxPublishDelay(Instant occurredAt, Instant publishedAt) {
    if (occurredAt == null || publishedAt == null || publishedAt.isBefore(occurredAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(occurredAt, publishedAt));
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }
}
