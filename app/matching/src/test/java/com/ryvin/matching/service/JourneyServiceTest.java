/*
 * どこで: JourneyService の単体テスト
 * 何を: 作成/応答/会議/期限処理の遷移と、同時操作時の一意性・冪等性を検証する
 * なぜ: 比較交換の再試行と部分一意制約に頼る箇所が、競合しても 1 回だけ効くことを保証するため
 */
package com.ryvin.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.doThrow;

import com.ryvin.matching.api.InvalidMeetingStateException;
import com.ryvin.matching.api.JourneyAlreadyExistsException;
import com.ryvin.matching.api.JourneyStateConflictException;
import com.ryvin.matching.api.MatchingAccessDeniedException;
import com.ryvin.matching.api.NotEligibleException;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.config.JourneyProperties;
import com.ryvin.matching.journey.JourneyStateMachine;
import com.ryvin.matching.journey.JourneyUpdate;
import com.ryvin.matching.model.CommandOutcome;
import com.ryvin.matching.model.Decision;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.JourneyTrigger;
import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import com.ryvin.matching.model.StageHistoryEntry;
import com.ryvin.matching.scoring.ExclusionReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class JourneyServiceTest {

  private static final Instant T0 = Instant.parse("2026-03-10T09:00:00Z");
  // 同時実行テストがハングしないよう、待機時間を固定する
  private static final Duration LATCH_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(10);

  static final JourneyProperties PROPERTIES =
      new JourneyProperties(
          Duration.ofHours(72),
          Duration.ofDays(14),
          Duration.ofHours(48),
          Duration.ofHours(6),
          Duration.ofHours(72),
          2,
          Duration.ofDays(30),
          3);

  private MutableClock clock;
  private InMemoryJourneyRepository journeyRepository;
  private InMemoryMeetingRequestRepository meetingRepository;
  private MatchingService matchingService;
  private SimpleMeterRegistry registry;
  private List<Object> publishedEvents;
  private JourneyTransitions transitions;
  private JourneyService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    journeyRepository = new InMemoryJourneyRepository();
    meetingRepository = new InMemoryMeetingRequestRepository();
    matchingService = Mockito.mock(MatchingService.class);
    registry = new SimpleMeterRegistry();
    publishedEvents = new CopyOnWriteArrayList<>();
    final JourneyStateMachine stateMachine = new JourneyStateMachine(PROPERTIES);
    transitions =
        new JourneyTransitions(
            journeyRepository,
            meetingRepository,
            stateMachine,
            PROPERTIES,
            new JourneyMetrics(registry),
            publishedEvents::add);
    service =
        new JourneyService(
            journeyRepository,
            meetingRepository,
            new InMemoryFeedbackRepository(),
            stateMachine,
            transitions,
            matchingService,
            PROPERTIES,
            clock);
  }

  @Test
  void createJourneyStartsInProposedWithInitiatorConsent() {
    final JourneyCommandResult result = service.createJourney("bob", "alice");

    final JourneyRecord journey = result.journey();
    assertThat(result.outcome()).isEqualTo(CommandOutcome.APPLIED);
    assertThat(journey.stage()).isEqualTo(JourneyStage.PROPOSED);
    assertThat(journey.participantLow()).isEqualTo("alice");
    assertThat(journey.participantHigh()).isEqualTo("bob");
    assertThat(journey.initiator()).isEqualTo("bob");
    assertThat(journey.consent().granted(JourneyStage.PROPOSED, "bob")).isTrue();
    assertThat(journey.deadline()).isEqualTo(T0.plus(Duration.ofHours(72)));
    assertThat(journeyRepository.findHistory(journey.journeyId()))
        .extracting(StageHistoryEntry::fromStage, StageHistoryEntry::stage)
        .containsExactly(tuple(null, JourneyStage.PROPOSED));
    assertThat(publishedEvents).hasSize(1);
    assertThat(
            registry
                .get("journey.transition.total")
                .tags("from", "none", "to", "PROPOSED", "trigger", "CREATED")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void createJourneyRejectsSecondActiveJourneyForSamePair() {
    final String existing = service.createJourney("alice", "bob").journey().journeyId();

    assertThatThrownBy(() -> service.createJourney("bob", "alice"))
        .isInstanceOf(JourneyAlreadyExistsException.class)
        .satisfies(
            ex ->
                assertThat(((JourneyAlreadyExistsException) ex).existingJourneyId())
                    .isEqualTo(existing));
  }

  @Test
  void createJourneyAllowedAgainAfterPreviousJourneyEnded() {
    final String first = service.createJourney("alice", "bob").journey().journeyId();
    service.respond(first, "bob", Decision.DECLINE, "not now");

    final JourneyCommandResult second = service.createJourney("alice", "bob");

    assertThat(second.journey().journeyId()).isNotEqualTo(first);
    assertThat(journeyRepository.size()).isEqualTo(2);
  }

  @Test
  void createJourneyValidatesInputAndEligibility() {
    assertThatThrownBy(() -> service.createJourney("alice", "alice"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.createJourney(" ", "bob"))
        .isInstanceOf(ValidationException.class);

    doThrow(new NotEligibleException(ExclusionReason.RECENTLY_DECLINED))
        .when(matchingService)
        .requireEligiblePair("alice", "carol");

    assertThatThrownBy(() -> service.createJourney("alice", "carol"))
        .isInstanceOf(NotEligibleException.class)
        .hasMessageContaining("recently_declined");
    assertThat(journeyRepository.size()).isZero();
  }

  @Test
  void concurrentCreationFromBothSidesKeepsSingleActiveJourney() throws Exception {
    final int threads = 8;
    final List<JourneyCommandResult> results = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();

    runConcurrently(
        threads,
        index -> {
          final String initiator = index % 2 == 0 ? "alice" : "bob";
          final String counterpart = index % 2 == 0 ? "bob" : "alice";
          return () -> results.add(service.createJourney(initiator, counterpart));
        },
        errors);

    assertThat(results).hasSize(1);
    assertThat(errors)
        .hasSize(threads - 1)
        .allMatch(JourneyAlreadyExistsException.class::isInstance);
    assertThat(journeyRepository.size()).isEqualTo(1);
    assertThat(journeyRepository.allHistory()).hasSize(1);
  }

  @Test
  void counterpartAcceptAdvancesToGuidedConversation() {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();

    final JourneyCommandResult initiatorAgain =
        service.respond(journeyId, "alice", Decision.ACCEPT, null);
    final JourneyCommandResult accepted = service.respond(journeyId, "bob", Decision.ACCEPT, null);

    assertThat(initiatorAgain.outcome()).isEqualTo(CommandOutcome.ALREADY_APPLIED);
    assertThat(accepted.outcome()).isEqualTo(CommandOutcome.APPLIED);
    assertThat(accepted.journey().stage()).isEqualTo(JourneyStage.GUIDED_CONVERSATION);
    assertThat(accepted.journey().deadline()).isEqualTo(T0.plus(Duration.ofDays(14)));
    assertThat(journeyRepository.findHistory(journeyId))
        .extracting(StageHistoryEntry::trigger)
        .containsExactly(
            JourneyTrigger.CREATED, JourneyTrigger.ACCEPTED, JourneyTrigger.AUTO_ADVANCED);
  }

  @Test
  void concurrentAcceptIsAppliedExactlyOnce() throws Exception {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();
    final int threads = 4;
    final List<JourneyCommandResult> results = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();

    runConcurrently(
        threads,
        index -> () -> results.add(service.respond(journeyId, "bob", Decision.ACCEPT, null)),
        errors);

    assertThat(errors).isEmpty();
    assertThat(results).hasSize(threads);
    assertThat(results)
        .filteredOn(result -> result.outcome() == CommandOutcome.APPLIED)
        .hasSize(1);
    assertThat(results)
        .allMatch(result -> result.journey().stage() == JourneyStage.GUIDED_CONVERSATION);
    assertThat(journeyRepository.findHistory(journeyId)).hasSize(3);
  }

  @Test
  void declineEndsJourneyAndLaterAcceptConflicts() {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();

    final JourneyCommandResult declined =
        service.respond(journeyId, "bob", Decision.DECLINE, "not a fit");
    final JourneyCommandResult repeated =
        service.respond(journeyId, "alice", Decision.DECLINE, null);

    assertThat(declined.journey().stage()).isEqualTo(JourneyStage.DECLINED);
    assertThat(declined.journey().endedBy()).isEqualTo("bob");
    assertThat(declined.journey().endReason()).isEqualTo("not a fit");
    assertThat(repeated.outcome()).isEqualTo(CommandOutcome.ALREADY_APPLIED);
    assertThatThrownBy(() -> service.respond(journeyId, "bob", Decision.ACCEPT, null))
        .isInstanceOf(JourneyStateConflictException.class)
        .satisfies(
            ex ->
                assertThat(((JourneyStateConflictException) ex).currentStage())
                    .isEqualTo(JourneyStage.DECLINED));
  }

  @Test
  void outsiderCannotRespondOrRead() {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();

    assertThatThrownBy(() -> service.respond(journeyId, "mallory", Decision.ACCEPT, null))
        .isInstanceOf(MatchingAccessDeniedException.class);
    assertThatThrownBy(() -> service.getJourney(journeyId, "mallory"))
        .isInstanceOf(MatchingAccessDeniedException.class);
    assertThatThrownBy(() -> service.listJourneys("alice", null, "mallory"))
        .isInstanceOf(MatchingAccessDeniedException.class);
  }

  @Test
  void meetingLifecycleReachesFeedbackStage() {
    final String journeyId = matchedJourney();
    final Instant meetingTime = T0.plus(Duration.ofDays(2));

    final MeetingCommandResult proposed =
        service.proposeMeeting(journeyId, "alice", meetingTime, " Cafe Lumen ");
    final String meetingId = proposed.meeting().meetingId();

    assertThat(proposed.journey().stage()).isEqualTo(JourneyStage.MEETING_PROPOSED);
    assertThat(proposed.meeting().status()).isEqualTo(MeetingStatus.PENDING);
    assertThat(proposed.meeting().location()).isEqualTo("Cafe Lumen");
    assertThat(proposed.meeting().respondBy()).isEqualTo(T0.plus(Duration.ofHours(48)));
    assertThatThrownBy(() -> service.respondToMeeting(meetingId, "alice", Decision.ACCEPT))
        .isInstanceOf(MatchingAccessDeniedException.class);

    final MeetingCommandResult accepted =
        service.respondToMeeting(meetingId, "bob", Decision.ACCEPT);
    final MeetingCommandResult acceptedAgain =
        service.respondToMeeting(meetingId, "bob", Decision.ACCEPT);

    assertThat(accepted.journey().stage()).isEqualTo(JourneyStage.MEETING_CONFIRMED);
    assertThat(accepted.meeting().respondedBy()).isEqualTo("bob");
    assertThat(acceptedAgain.outcome()).isEqualTo(CommandOutcome.ALREADY_APPLIED);
    assertThatThrownBy(() -> service.completeMeeting(meetingId, "alice"))
        .isInstanceOf(InvalidMeetingStateException.class)
        .hasMessageContaining("not started");

    clock.set(meetingTime.plus(Duration.ofHours(1)));
    final MeetingCommandResult completed = service.completeMeeting(meetingId, "alice");

    assertThat(completed.meeting().status()).isEqualTo(MeetingStatus.COMPLETED);
    assertThat(completed.journey().stage()).isEqualTo(JourneyStage.POST_MEETING_FEEDBACK);
    assertThat(service.completeMeeting(meetingId, "bob").outcome())
        .isEqualTo(CommandOutcome.ALREADY_APPLIED);
  }

  @Test
  void proposeMeetingValidatesTimeAndLocation() {
    final String journeyId = matchedJourney();

    assertThatThrownBy(() -> service.proposeMeeting(journeyId, "alice", T0, "Cafe"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(
            () -> service.proposeMeeting(journeyId, "alice", T0.plusSeconds(3600), " "))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(
            () ->
                service.proposeMeeting(
                    journeyId, "alice", T0.plusSeconds(3600), "x".repeat(201)))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void proposeMeetingOutsideConversationConflicts() {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();

    assertThatThrownBy(
            () -> service.proposeMeeting(journeyId, "alice", T0.plusSeconds(3600), "Cafe"))
        .isInstanceOf(JourneyStateConflictException.class);
    assertThat(meetingRepository.findByJourney(journeyId)).isEmpty();
  }

  @Test
  void thirdDeclinedMeetingExpiresJourney() {
    final String journeyId = matchedJourney();
    JourneyRecord journey = null;
    for (int attempt = 1; attempt <= 3; attempt++) {
      final String meetingId =
          service
              .proposeMeeting(journeyId, "alice", T0.plus(Duration.ofDays(attempt)), "Cafe")
              .meeting()
              .meetingId();
      journey = service.respondToMeeting(meetingId, "bob", Decision.DECLINE).journey();
    }

    assertThat(journey.stage()).isEqualTo(JourneyStage.EXPIRED);
    assertThat(journey.failedMeetingAttempts()).isEqualTo(3);
    assertThat(meetingRepository.findByJourney(journeyId))
        .extracting(MeetingRequestRecord::status)
        .containsOnly(MeetingStatus.DECLINED);
  }

  @Test
  void meetingResponseAfterDeadlineIsRejected() {
    final String journeyId = matchedJourney();
    final String meetingId =
        service
            .proposeMeeting(journeyId, "alice", T0.plus(Duration.ofDays(5)), "Cafe")
            .meeting()
            .meetingId();

    clock.advance(Duration.ofHours(49));

    assertThatThrownBy(() -> service.respondToMeeting(meetingId, "bob", Decision.ACCEPT))
        .isInstanceOf(InvalidMeetingStateException.class);
  }

  @Test
  void declineClosesOpenMeeting() {
    final String journeyId = matchedJourney();
    final String meetingId =
        service
            .proposeMeeting(journeyId, "alice", T0.plus(Duration.ofDays(1)), "Cafe")
            .meeting()
            .meetingId();

    service.respond(journeyId, "bob", Decision.DECLINE, null);

    assertThat(meetingRepository.findById(meetingId))
        .hasValueSatisfying(
            meeting -> assertThat(meeting.status()).isEqualTo(MeetingStatus.EXPIRED));
  }

  @Test
  void applyDeadlineExpiresOverdueProposalOnce() {
    service.createJourney("alice", "bob");
    clock.advance(Duration.ofHours(73));
    final JourneyRecord snapshot = journeyRepository.findOverdue(Instant.now(clock), 10).get(0);

    final SweepOutcome first = service.applyDeadline(snapshot);
    final SweepOutcome stale = service.applyDeadline(snapshot);

    assertThat(first).isEqualTo(SweepOutcome.TRANSITIONED);
    assertThat(stale).isEqualTo(SweepOutcome.CONFLICT);
    final JourneyRecord expired = journeyRepository.findById(snapshot.journeyId()).orElseThrow();
    assertThat(expired.stage()).isEqualTo(JourneyStage.EXPIRED);
    assertThat(expired.endedBy()).isEqualTo("system");
    assertThat(registry.get("journey.cas.conflict.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void applyDeadlineExpiresUnansweredMeetingBackToConversation() {
    final String journeyId = matchedJourney();
    final String meetingId =
        service
            .proposeMeeting(journeyId, "alice", T0.plus(Duration.ofDays(5)), "Cafe")
            .meeting()
            .meetingId();
    clock.advance(Duration.ofHours(48));
    final JourneyRecord snapshot = journeyRepository.findById(journeyId).orElseThrow();

    assertThat(service.applyDeadline(snapshot)).isEqualTo(SweepOutcome.TRANSITIONED);

    final JourneyRecord journey = journeyRepository.findById(journeyId).orElseThrow();
    assertThat(journey.stage()).isEqualTo(JourneyStage.GUIDED_CONVERSATION);
    assertThat(journey.failedMeetingAttempts()).isEqualTo(1);
    assertThat(meetingRepository.findById(meetingId).orElseThrow().status())
        .isEqualTo(MeetingStatus.EXPIRED);
  }

  @Test
  void applyDeadlineCompletesConfirmedMeetingAfterGrace() {
    final String journeyId = matchedJourney();
    final Instant meetingTime = T0.plus(Duration.ofDays(2));
    final String meetingId =
        service.proposeMeeting(journeyId, "alice", meetingTime, "Cafe").meeting().meetingId();
    service.respondToMeeting(meetingId, "bob", Decision.ACCEPT);
    clock.set(meetingTime.plus(Duration.ofHours(6)));
    final JourneyRecord snapshot = journeyRepository.findById(journeyId).orElseThrow();

    assertThat(service.applyDeadline(snapshot)).isEqualTo(SweepOutcome.TRANSITIONED);

    assertThat(journeyRepository.findById(journeyId).orElseThrow().stage())
        .isEqualTo(JourneyStage.POST_MEETING_FEEDBACK);
    assertThat(meetingRepository.findById(meetingId).orElseThrow().status())
        .isEqualTo(MeetingStatus.COMPLETED);
  }

  @Test
  void applyDeadlineSkipsJourneyWhoseDeadlineMoved() {
    final JourneyRecord created = service.createJourney("alice", "bob").journey();

    assertThat(service.applyDeadline(created)).isEqualTo(SweepOutcome.SKIPPED);
  }

  @Test
  void getJourneyReportsTimeInStageAndMeetings() {
    final String journeyId = matchedJourney();
    service.proposeMeeting(journeyId, "alice", T0.plus(Duration.ofDays(1)), "Cafe");
    clock.advance(Duration.ofMinutes(30));

    final JourneyView view = service.getJourney(journeyId, "bob");

    assertThat(view.journey().stage()).isEqualTo(JourneyStage.MEETING_PROPOSED);
    assertThat(view.history()).hasSize(4);
    assertThat(view.meetings()).hasSize(1);
    assertThat(view.timeInStage().get(JourneyStage.MEETING_PROPOSED))
        .isEqualTo(Duration.ofMinutes(30));
    assertThat(service.listJourneys("alice", JourneyStage.MEETING_PROPOSED, "alice")).hasSize(1);
    assertThat(service.listJourneys("alice", JourneyStage.ONGOING, "alice")).isEmpty();
  }

  @Test
  void everyJourneyMutationLocksTheRowBeforeWriting() {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();
    final String lock = "lock:" + journeyId;
    final String cas = "cas:" + journeyId;

    journeyRepository.clearOperations();
    service.respond(journeyId, "bob", Decision.ACCEPT, null);
    assertThat(journeyRepository.operations()).containsExactly(lock, cas);

    journeyRepository.clearOperations();
    final Instant meetingTime = T0.plus(Duration.ofDays(2));
    final String meetingId =
        service.proposeMeeting(journeyId, "alice", meetingTime, "Cafe").meeting().meetingId();
    assertThat(journeyRepository.operations()).containsExactly(lock, cas);

    journeyRepository.clearOperations();
    service.respondToMeeting(meetingId, "bob", Decision.ACCEPT);
    assertThat(journeyRepository.operations()).containsExactly(lock, cas);

    journeyRepository.clearOperations();
    clock.set(meetingTime.plus(Duration.ofHours(1)));
    service.completeMeeting(meetingId, "alice");
    assertThat(journeyRepository.operations()).containsExactly(lock, cas);

    final String proposalId = service.createJourney("carol", "dave").journey().journeyId();
    clock.advance(Duration.ofHours(73));
    final JourneyRecord overdue = journeyRepository.findById(proposalId).orElseThrow();
    journeyRepository.clearOperations();
    assertThat(service.applyDeadline(overdue)).isEqualTo(SweepOutcome.TRANSITIONED);
    assertThat(journeyRepository.operations())
        .containsExactly("lock:" + proposalId, "cas:" + proposalId);
  }

  @Test
  void writeRefusesTransitionOutsideTheStageGraph() {
    final JourneyRecord created = service.createJourney("alice", "bob").journey();
    publishedEvents.clear();
    final JourneyUpdate skipToOngoing =
        update(
            created,
            JourneyStage.ONGOING,
            new StageHistoryEntry(
                created.journeyId(),
                JourneyStage.PROPOSED,
                JourneyStage.ONGOING,
                "alice",
                JourneyTrigger.FEEDBACK_COMPLETED,
                T0));

    assertThatThrownBy(() -> transitions.write(skipToOngoing))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("illegal stage transition");

    final JourneyRecord unchanged = journeyRepository.findById(created.journeyId()).orElseThrow();
    assertThat(unchanged.stage()).isEqualTo(JourneyStage.PROPOSED);
    assertThat(unchanged.version()).isEqualTo(created.version());
    assertThat(journeyRepository.findHistory(created.journeyId())).hasSize(1);
    assertThat(publishedEvents).isEmpty();
  }

  @Test
  void writeRefusesHistoryThatDoesNotStartAtTheExpectedStage() {
    final JourneyRecord created = service.createJourney("alice", "bob").journey();
    final JourneyUpdate detached =
        update(
            created,
            JourneyStage.GUIDED_CONVERSATION,
            new StageHistoryEntry(
                created.journeyId(),
                JourneyStage.MUTUAL_MATCH,
                JourneyStage.GUIDED_CONVERSATION,
                "system",
                JourneyTrigger.AUTO_ADVANCED,
                T0));

    assertThatThrownBy(() -> transitions.write(detached))
        .isInstanceOf(IllegalStateException.class);
    assertThat(journeyRepository.findById(created.journeyId()).orElseThrow().stage())
        .isEqualTo(JourneyStage.PROPOSED);
  }

  private static JourneyUpdate update(
      JourneyRecord journey, JourneyStage target, StageHistoryEntry entry) {
    return new JourneyUpdate(
        journey.journeyId(),
        journey.stage(),
        journey.version(),
        target,
        journey.consent(),
        null,
        journey.failedMeetingAttempts(),
        null,
        null,
        T0,
        List.of(entry));
  }

  private String matchedJourney() {
    final String journeyId = service.createJourney("alice", "bob").journey().journeyId();
    service.respond(journeyId, "bob", Decision.ACCEPT, null);
    return journeyId;
  }

  private void runConcurrently(int threads, IntFunction<Runnable> taskFor, List<Throwable> errors)
      throws InterruptedException {
    final CountDownLatch ready = new CountDownLatch(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final CountDownLatch done = new CountDownLatch(threads);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      for (int i = 0; i < threads; i++) {
        final Runnable task = taskFor.apply(i);
        executor.submit(
            () -> {
              try {
                // 全スレッドが揃ってから同時に開始し、競合する状況を作る
                ready.countDown();
                if (!start.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                  errors.add(new IllegalStateException("start latch timeout"));
                  return;
                }
                task.run();
              } catch (Throwable ex) {
                errors.add(ex);
              } finally {
                done.countDown();
              }
            });
      }
      assertThat(ready.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
      start.countDown();
      assertThat(done.await(COMPLETION_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }
  }
}
