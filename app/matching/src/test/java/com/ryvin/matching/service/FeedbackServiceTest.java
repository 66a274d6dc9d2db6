package com.ryvin.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ryvin.matching.api.DuplicateFeedbackException;
import com.ryvin.matching.api.InvalidMeetingStateException;
import com.ryvin.matching.api.MatchingAccessDeniedException;
import com.ryvin.matching.api.MeetingRequestNotFoundException;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.journey.JourneyStateMachine;
import com.ryvin.matching.model.Decision;
import com.ryvin.matching.model.FeedbackRecord;
import com.ryvin.matching.model.FeedbackSummary;
import com.ryvin.matching.model.JourneyStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class FeedbackServiceTest {

  private static final Instant T0 = Instant.parse("2026-03-10T09:00:00Z");

  private MutableClock clock;
  private InMemoryJourneyRepository journeyRepository;
  private SimpleMeterRegistry registry;
  private JourneyService journeyService;
  private FeedbackService feedbackService;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    journeyRepository = new InMemoryJourneyRepository();
    final InMemoryMeetingRequestRepository meetingRepository =
        new InMemoryMeetingRequestRepository();
    final InMemoryFeedbackRepository feedbackRepository = new InMemoryFeedbackRepository();
    registry = new SimpleMeterRegistry();
    final JourneyMetrics metrics = new JourneyMetrics(registry);
    final JourneyStateMachine stateMachine = new JourneyStateMachine(JourneyServiceTest.PROPERTIES);
    final JourneyTransitions transitions =
        new JourneyTransitions(
            journeyRepository,
            meetingRepository,
            stateMachine,
            JourneyServiceTest.PROPERTIES,
            metrics,
            new ArrayList<Object>()::add);
    journeyService =
        new JourneyService(
            journeyRepository,
            meetingRepository,
            feedbackRepository,
            stateMachine,
            transitions,
            Mockito.mock(MatchingService.class),
            JourneyServiceTest.PROPERTIES,
            clock);
    feedbackService =
        new FeedbackService(
            meetingRepository, feedbackRepository, journeyRepository, transitions, metrics, clock);
  }

  @Test
  void bothSubmissionsMoveJourneyToOngoing() {
    final String meetingId = completedMeeting();

    final FeedbackSubmission first = feedbackService.submit(meetingId, "alice", 5, "great", true);
    final FeedbackSubmission second = feedbackService.submit(meetingId, "bob", 4, null, true);

    assertThat(first.journey().stage()).isEqualTo(JourneyStage.POST_MEETING_FEEDBACK);
    assertThat(first.feedback().aboutUserId()).isEqualTo("bob");
    assertThat(second.journey().stage()).isEqualTo(JourneyStage.ONGOING);
    assertThat(registry.get("feedback.submitted.total").counter().count()).isEqualTo(2.0);
  }

  @Test
  void duplicateSubmissionIsRejected() {
    final String meetingId = completedMeeting();
    feedbackService.submit(meetingId, "alice", 3, null, false);

    assertThatThrownBy(() -> feedbackService.submit(meetingId, "alice", 4, null, true))
        .isInstanceOf(DuplicateFeedbackException.class);
  }

  @Test
  void feedbackRequiresCompletedMeetingAndParticipant() {
    final String journeyId = journeyService.createJourney("alice", "bob").journey().journeyId();
    journeyService.respond(journeyId, "bob", Decision.ACCEPT, null);
    final String pending =
        journeyService
            .proposeMeeting(journeyId, "alice", T0.plus(Duration.ofDays(1)), "Cafe")
            .meeting()
            .meetingId();

    assertThatThrownBy(() -> feedbackService.submit(pending, "alice", 4, null, true))
        .isInstanceOf(InvalidMeetingStateException.class);
    assertThatThrownBy(() -> feedbackService.submit(pending, "mallory", 4, null, true))
        .isInstanceOf(MatchingAccessDeniedException.class);
    assertThatThrownBy(() -> feedbackService.submit("missing", "alice", 4, null, true))
        .isInstanceOf(MeetingRequestNotFoundException.class);
  }

  @Test
  void ratingAndCommentAreValidated() {
    assertThatThrownBy(() -> feedbackService.submit("meeting-1", "alice", 0, null, true))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> feedbackService.submit("meeting-1", "alice", 6, null, true))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(
            () -> feedbackService.submit("meeting-1", "alice", 3, "x".repeat(1001), true))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void listAndSummaryAreScopedToRequester() {
    final String meetingId = completedMeeting();
    feedbackService.submit(meetingId, "alice", 5, null, true);
    feedbackService.submit(meetingId, "bob", 2, null, false);

    assertThat(feedbackService.listFeedback("alice", FeedbackService.Direction.SUBMITTED, "alice"))
        .extracting(FeedbackRecord::rating)
        .containsExactly(5);
    assertThat(feedbackService.listFeedback("alice", FeedbackService.Direction.RECEIVED, "alice"))
        .extracting(FeedbackRecord::rating)
        .containsExactly(2);
    final FeedbackSummary summary = feedbackService.summarize("bob", "bob");
    assertThat(summary.count()).isEqualTo(1);
    assertThat(summary.averageRating()).isEqualTo(5.0);
    assertThat(summary.continueRatio()).isEqualTo(1.0);
    assertThatThrownBy(() -> feedbackService.summarize("bob", "alice"))
        .isInstanceOf(MatchingAccessDeniedException.class);
  }

  @Test
  void directionParsingDefaultsToSubmitted() {
    assertThat(FeedbackService.Direction.fromValue(null))
        .isEqualTo(FeedbackService.Direction.SUBMITTED);
    assertThat(FeedbackService.Direction.fromValue("received"))
        .isEqualTo(FeedbackService.Direction.RECEIVED);
    assertThatThrownBy(() -> FeedbackService.Direction.fromValue("sideways"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void deadlineWithPartialFeedbackCompletesJourney() {
    final String meetingId = completedMeeting();
    feedbackService.submit(meetingId, "alice", 4, null, true);
    clock.advance(Duration.ofHours(73));
    final String journeyId =
        journeyRepository.findOverdue(Instant.now(clock), 10).get(0).journeyId();

    final SweepOutcome outcome =
        journeyService.applyDeadline(journeyRepository.findById(journeyId).orElseThrow());

    assertThat(outcome).isEqualTo(SweepOutcome.TRANSITIONED);
    assertThat(journeyRepository.findById(journeyId).orElseThrow().stage())
        .isEqualTo(JourneyStage.ONGOING);
  }

  @Test
  void deadlineWithoutFeedbackExpiresJourney() {
    completedMeeting();
    clock.advance(Duration.ofHours(73));
    final String journeyId =
        journeyRepository.findOverdue(Instant.now(clock), 10).get(0).journeyId();

    journeyService.applyDeadline(journeyRepository.findById(journeyId).orElseThrow());

    assertThat(journeyRepository.findById(journeyId).orElseThrow().stage())
        .isEqualTo(JourneyStage.EXPIRED);
  }

  private String completedMeeting() {
    final String journeyId = journeyService.createJourney("alice", "bob").journey().journeyId();
    journeyService.respond(journeyId, "bob", Decision.ACCEPT, null);
    final Instant meetingTime = T0.plus(Duration.ofDays(1));
    final String meetingId =
        journeyService
            .proposeMeeting(journeyId, "alice", meetingTime, "Cafe")
            .meeting()
            .meetingId();
    journeyService.respondToMeeting(meetingId, "bob", Decision.ACCEPT);
    clock.set(meetingTime.plus(Duration.ofHours(2)));
    journeyService.completeMeeting(meetingId, "bob");
    return meetingId;
  }
}
