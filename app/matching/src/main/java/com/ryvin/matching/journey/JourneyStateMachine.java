/*
 * どこで: Matching Journey 状態機械
 * 何を: (現在の Journey, イベント) から次の状態を決める遷移表を提供する
 * なぜ: 遷移判定を I/O の無い純粋関数に閉じ込め、比較交換の再試行時に何度でも再評価できるようにするため
 */
package com.ryvin.matching.journey;

import com.ryvin.matching.config.JourneyProperties;
import com.ryvin.matching.model.ConsentLedger;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.JourneyTrigger;
import com.ryvin.matching.model.StageHistoryEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Journey の遷移表。
 *
 * <pre>
 * PROPOSED              --ACCEPT(相手)-------> MUTUAL_MATCH --(自動)--> GUIDED_CONVERSATION
 * GUIDED_CONVERSATION   --PROPOSE_MEETING----> MEETING_PROPOSED
 * MEETING_PROPOSED      --MEETING_ACCEPTED---> MEETING_CONFIRMED
 * MEETING_PROPOSED      --MEETING_DECLINED/EXPIRED--> GUIDED_CONVERSATION (上限超過で EXPIRED)
 * MEETING_CONFIRMED     --MEETING_COMPLETED--> POST_MEETING_FEEDBACK
 * POST_MEETING_FEEDBACK --FEEDBACK_COMPLETED-> ONGOING
 * 非終端                --DECLINE-----------> DECLINED
 * 非終端                --DEADLINE_EXPIRED--> EXPIRED
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class JourneyStateMachine {

  private final JourneyProperties properties;

  public TransitionResult apply(JourneyRecord journey, JourneyEvent event) {
    return switch (event.type()) {
      case ACCEPT -> onAccept(journey, event);
      case DECLINE -> onDecline(journey, event);
      case PROPOSE_MEETING -> onProposeMeeting(journey, event);
      case MEETING_ACCEPTED -> onMeetingAccepted(journey, event);
      case MEETING_DECLINED -> onMeetingFailed(journey, event, JourneyTrigger.MEETING_DECLINED);
      case MEETING_EXPIRED -> onMeetingFailed(journey, event, JourneyTrigger.MEETING_EXPIRED);
      case MEETING_COMPLETED -> onMeetingCompleted(journey, event);
      case FEEDBACK_COMPLETED -> onFeedbackCompleted(journey, event);
      case DEADLINE_EXPIRED -> onDeadline(journey, event);
    };
  }

  /** PROPOSED の開始時点の期限。 */
  public Instant proposalDeadline(Instant createdAt) {
    return createdAt.plus(properties.proposalTimeout());
  }

  private TransitionResult onAccept(JourneyRecord journey, JourneyEvent event) {
    final JourneyStage stage = journey.stage();
    if (stage == JourneyStage.DECLINED || stage == JourneyStage.EXPIRED) {
      return TransitionResult.rejected("journey is already " + stage);
    }
    if (journey.consent().granted(JourneyStage.PROPOSED, event.actor())) {
      return TransitionResult.alreadyApplied();
    }
    if (stage != JourneyStage.PROPOSED) {
      return TransitionResult.rejected("journey is not awaiting a response");
    }
    // 相互承認で MUTUAL_MATCH に入ると両者の同意が揃うため、同じ書き込みで GUIDED_CONVERSATION まで進める
    ConsentLedger consent = journey.consent().grant(JourneyStage.PROPOSED, event.actor());
    for (String participant : journey.participants()) {
      consent = consent.grant(JourneyStage.MUTUAL_MATCH, participant);
    }
    final List<StageHistoryEntry> history = new ArrayList<>();
    history.add(entry(journey, stage, JourneyStage.MUTUAL_MATCH, event, JourneyTrigger.ACCEPTED));
    if (consent.grantedByAll(JourneyStage.MUTUAL_MATCH, journey.participants())) {
      history.add(
          new StageHistoryEntry(
              journey.journeyId(),
              JourneyStage.MUTUAL_MATCH,
              JourneyStage.GUIDED_CONVERSATION,
              JourneyEvent.SYSTEM_ACTOR,
              JourneyTrigger.AUTO_ADVANCED,
              event.at()));
    }
    final JourneyStage target = history.get(history.size() - 1).stage();
    return TransitionResult.applied(
        new JourneyUpdate(
            journey.journeyId(),
            stage,
            journey.version(),
            target,
            consent,
            event.at().plus(properties.conversationTimeout()),
            journey.failedMeetingAttempts(),
            null,
            null,
            event.at(),
            history));
  }

  private TransitionResult onDecline(JourneyRecord journey, JourneyEvent event) {
    final JourneyStage stage = journey.stage();
    if (stage == JourneyStage.DECLINED) {
      return TransitionResult.alreadyApplied();
    }
    if (stage.terminal()) {
      return TransitionResult.rejected("journey is already " + stage);
    }
    return TransitionResult.applied(
        terminate(journey, JourneyStage.DECLINED, event, JourneyTrigger.DECLINED, event.reason()));
  }

  private TransitionResult onProposeMeeting(JourneyRecord journey, JourneyEvent event) {
    if (journey.stage() != JourneyStage.GUIDED_CONVERSATION) {
      return TransitionResult.rejected(
          "meeting can only be proposed during guided conversation, current=" + journey.stage());
    }
    return TransitionResult.applied(
        advance(
            journey,
            JourneyStage.MEETING_PROPOSED,
            event,
            JourneyTrigger.MEETING_PROPOSED,
            event.at().plus(properties.meetingResponseTimeout()),
            journey.failedMeetingAttempts()));
  }

  private TransitionResult onMeetingAccepted(JourneyRecord journey, JourneyEvent event) {
    if (journey.stage() == JourneyStage.MEETING_CONFIRMED) {
      return TransitionResult.alreadyApplied();
    }
    if (journey.stage() != JourneyStage.MEETING_PROPOSED) {
      return TransitionResult.rejected("no meeting is awaiting a response");
    }
    return TransitionResult.applied(
        advance(
            journey,
            JourneyStage.MEETING_CONFIRMED,
            event,
            JourneyTrigger.MEETING_ACCEPTED,
            event.meetingTime().plus(properties.meetingCompletionGrace()),
            journey.failedMeetingAttempts()));
  }

  private TransitionResult onMeetingFailed(
      JourneyRecord journey, JourneyEvent event, JourneyTrigger trigger) {
    if (journey.stage() != JourneyStage.MEETING_PROPOSED) {
      return TransitionResult.rejected("no meeting is awaiting a response");
    }
    final int attempts = journey.failedMeetingAttempts() + 1;
    if (attempts > properties.maxMeetingRetries()) {
      final JourneyUpdate expired =
          terminate(journey, JourneyStage.EXPIRED, event, trigger, "meeting_retries_exhausted");
      return TransitionResult.applied(withAttempts(expired, attempts));
    }
    return TransitionResult.applied(
        advance(
            journey,
            JourneyStage.GUIDED_CONVERSATION,
            event,
            trigger,
            event.at().plus(properties.conversationTimeout()),
            attempts));
  }

  private TransitionResult onMeetingCompleted(JourneyRecord journey, JourneyEvent event) {
    final JourneyStage stage = journey.stage();
    if (stage == JourneyStage.POST_MEETING_FEEDBACK || stage == JourneyStage.ONGOING) {
      return TransitionResult.alreadyApplied();
    }
    if (stage != JourneyStage.MEETING_CONFIRMED) {
      return TransitionResult.rejected("no confirmed meeting to complete, current=" + stage);
    }
    return TransitionResult.applied(
        advance(
            journey,
            JourneyStage.POST_MEETING_FEEDBACK,
            event,
            JourneyTrigger.MEETING_COMPLETED,
            event.at().plus(properties.feedbackWindow()),
            journey.failedMeetingAttempts()));
  }

  private TransitionResult onFeedbackCompleted(JourneyRecord journey, JourneyEvent event) {
    if (journey.stage() == JourneyStage.ONGOING) {
      return TransitionResult.alreadyApplied();
    }
    if (journey.stage() != JourneyStage.POST_MEETING_FEEDBACK) {
      return TransitionResult.rejected("journey is not collecting feedback");
    }
    return TransitionResult.applied(
        advance(
            journey,
            JourneyStage.ONGOING,
            event,
            JourneyTrigger.FEEDBACK_COMPLETED,
            null,
            journey.failedMeetingAttempts()));
  }

  private TransitionResult onDeadline(JourneyRecord journey, JourneyEvent event) {
    if (journey.stage() == JourneyStage.EXPIRED) {
      return TransitionResult.alreadyApplied();
    }
    if (journey.stage().terminal()) {
      return TransitionResult.rejected("journey is already " + journey.stage());
    }
    if (journey.deadline() == null || event.at().isBefore(journey.deadline())) {
      return TransitionResult.rejected("deadline has not passed");
    }
    return TransitionResult.applied(
        terminate(
            journey, JourneyStage.EXPIRED, event, JourneyTrigger.DEADLINE_EXPIRED, "deadline"));
  }

  private JourneyUpdate advance(
      JourneyRecord journey,
      JourneyStage target,
      JourneyEvent event,
      JourneyTrigger trigger,
      Instant deadline,
      int failedMeetingAttempts) {
    return new JourneyUpdate(
        journey.journeyId(),
        journey.stage(),
        journey.version(),
        target,
        journey.consent(),
        deadline,
        failedMeetingAttempts,
        null,
        null,
        event.at(),
        List.of(entry(journey, journey.stage(), target, event, trigger)));
  }

  private JourneyUpdate terminate(
      JourneyRecord journey,
      JourneyStage target,
      JourneyEvent event,
      JourneyTrigger trigger,
      String reason) {
    return new JourneyUpdate(
        journey.journeyId(),
        journey.stage(),
        journey.version(),
        target,
        journey.consent(),
        null,
        journey.failedMeetingAttempts(),
        event.actor(),
        reason,
        event.at(),
        List.of(entry(journey, journey.stage(), target, event, trigger)));
  }

  private JourneyUpdate withAttempts(JourneyUpdate update, int attempts) {
    return new JourneyUpdate(
        update.journeyId(),
        update.expectedStage(),
        update.expectedVersion(),
        update.newStage(),
        update.consent(),
        update.deadline(),
        attempts,
        update.endedBy(),
        update.endReason(),
        update.updatedAt(),
        update.history());
  }

  private static StageHistoryEntry entry(
      JourneyRecord journey,
      JourneyStage from,
      JourneyStage to,
      JourneyEvent event,
      JourneyTrigger trigger) {
    return new StageHistoryEntry(journey.journeyId(), from, to, event.actor(), trigger, event.at());
  }
}
