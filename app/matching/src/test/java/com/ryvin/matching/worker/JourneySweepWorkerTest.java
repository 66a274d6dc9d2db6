package com.ryvin.matching.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ryvin.matching.config.JourneySweepProperties;
import com.ryvin.matching.model.ConsentLedger;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.repository.JourneyRepository;
import com.ryvin.matching.service.JourneyMetrics;
import com.ryvin.matching.service.JourneyService;
import com.ryvin.matching.service.SweepOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class JourneySweepWorkerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final JourneySweepProperties PROPERTIES =
      new JourneySweepProperties(true, Duration.ofSeconds(30), 25);

  @Test
  void sweepOnceAppliesDeadlinesAndCountsOutcomes() {
    final JourneyRepository repository = Mockito.mock(JourneyRepository.class);
    final JourneyService service = Mockito.mock(JourneyService.class);
    final JourneyMetrics metrics = Mockito.mock(JourneyMetrics.class);
    final JourneyRecord expired = overdue("journey-1");
    final JourneyRecord raced = overdue("journey-2");
    when(repository.findOverdue(NOW, 25)).thenReturn(List.of(expired, raced));
    when(service.applyDeadline(expired)).thenReturn(SweepOutcome.TRANSITIONED);
    when(service.applyDeadline(raced)).thenReturn(SweepOutcome.CONFLICT);

    final int transitioned = newWorker(repository, service, metrics).sweepOnce();

    assertThat(transitioned).isEqualTo(1);
    verify(metrics).recordSweepResult("transitioned");
    verify(metrics).recordSweepResult("conflict");
  }

  @Test
  void sweepOnceContinuesAfterFailure() {
    final JourneyRepository repository = Mockito.mock(JourneyRepository.class);
    final JourneyService service = Mockito.mock(JourneyService.class);
    final JourneyMetrics metrics = Mockito.mock(JourneyMetrics.class);
    final JourneyRecord broken = overdue("journey-1");
    final JourneyRecord healthy = overdue("journey-2");
    when(repository.findOverdue(NOW, 25)).thenReturn(List.of(broken, healthy));
    when(service.applyDeadline(broken)).thenThrow(new IllegalStateException("db down"));
    when(service.applyDeadline(healthy)).thenReturn(SweepOutcome.TRANSITIONED);

    final int transitioned = newWorker(repository, service, metrics).sweepOnce();

    assertThat(transitioned).isEqualTo(1);
    verify(metrics).recordSweepResult("error");
    verify(metrics).recordSweepResult("transitioned");
  }

  @Test
  void sweepOnceDoesNothingWithoutOverdueJourneys() {
    final JourneyRepository repository = Mockito.mock(JourneyRepository.class);
    final JourneyService service = Mockito.mock(JourneyService.class);
    final JourneyMetrics metrics = Mockito.mock(JourneyMetrics.class);
    when(repository.findOverdue(eq(NOW), eq(25))).thenReturn(List.of());

    assertThat(newWorker(repository, service, metrics).sweepOnce()).isZero();
    verify(service, never()).applyDeadline(any());
  }

  private static JourneySweepWorker newWorker(
      JourneyRepository repository, JourneyService service, JourneyMetrics metrics) {
    return new JourneySweepWorker(
        repository, service, PROPERTIES, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static JourneyRecord overdue(String journeyId) {
    return new JourneyRecord(
        journeyId,
        "alice",
        "bob",
        "alice",
        JourneyStage.PROPOSED,
        1,
        ConsentLedger.empty(),
        NOW.minusSeconds(60),
        0,
        null,
        null,
        NOW.minus(Duration.ofDays(4)),
        NOW.minus(Duration.ofDays(4)));
  }
}
