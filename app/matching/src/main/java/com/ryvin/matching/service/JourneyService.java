/*
 * どこで: Matching サービス層
 * 何を: Journey の作成/応答/会議の提案・応答・完了と参照を提供する
 * なぜ: 参加者の操作を状態機械と比較交換に通し、同時操作でも一貫した結果を返すため
 */
package com.ryvin.matching.service;

import com.ryvin.matching.api.InvalidMeetingStateException;
import com.ryvin.matching.api.JourneyAlreadyExistsException;
import com.ryvin.matching.api.JourneyStateConflictException;
import com.ryvin.matching.api.MatchingAccessDeniedException;
import com.ryvin.matching.api.MeetingRequestNotFoundException;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.config.JourneyProperties;
import com.ryvin.matching.journey.JourneyEvent;
import com.ryvin.matching.journey.JourneyStateMachine;
import com.ryvin.matching.journey.StageDurations;
import com.ryvin.matching.journey.TransitionResult;
import com.ryvin.matching.model.CommandOutcome;
import com.ryvin.matching.model.ConsentLedger;
import com.ryvin.matching.model.Decision;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.JourneyTrigger;
import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import com.ryvin.matching.model.StageHistoryEntry;
import com.ryvin.matching.repository.FeedbackRepository;
import com.ryvin.matching.repository.JourneyRepository;
import com.ryvin.matching.repository.MeetingRequestRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class JourneyService {

  private static final Logger logger = LoggerFactory.getLogger(JourneyService.class);
  private static final int MAX_LOCATION_LENGTH = 200;
  private static final int MAX_REASON_LENGTH = 200;

  private final JourneyRepository journeyRepository;
  private final MeetingRequestRepository meetingRequestRepository;
  private final FeedbackRepository feedbackRepository;
  private final JourneyStateMachine stateMachine;
  private final JourneyTransitions transitions;
  private final MatchingService matchingService;
  private final JourneyProperties properties;
  private final Clock clock;

  /**
   * 役割: 2 人の間に新しい Journey を作る。
   * 動作: 進行中の Journey が既にあれば、その id を添えて AlreadyExists を返す。同時作成は DB の一意制約で
   * 1 件に絞り、負けた側も AlreadyExists になる。
   * 前提: initiator は作成時点で PROPOSED の同意を済ませたものとして記録する。
   */
  @Transactional
  public JourneyCommandResult createJourney(String initiator, String counterpart) {
    requireUserId(initiator, "initiator");
    requireUserId(counterpart, "counterpart");
    if (initiator.equals(counterpart)) {
      throw new ValidationException("cannot start a journey with yourself");
    }
    final String low = initiator.compareTo(counterpart) < 0 ? initiator : counterpart;
    final String high = low.equals(initiator) ? counterpart : initiator;
    final Optional<JourneyRecord> active = journeyRepository.findActiveByPair(low, high);
    if (active.isPresent()) {
      throw new JourneyAlreadyExistsException(active.get().journeyId());
    }
    matchingService.requireEligiblePair(initiator, counterpart);

    for (int attempt = 1; attempt <= properties.casMaxAttempts(); attempt++) {
      final Instant now = Instant.now(clock);
      final JourneyRecord draft =
          new JourneyRecord(
              UUID.randomUUID().toString(),
              low,
              high,
              initiator,
              JourneyStage.PROPOSED,
              0L,
              ConsentLedger.empty().grant(JourneyStage.PROPOSED, initiator),
              stateMachine.proposalDeadline(now),
              0,
              null,
              null,
              now,
              now);
      final Optional<JourneyRecord> inserted = journeyRepository.insertIfNoActive(draft);
      if (inserted.isPresent()) {
        final List<StageHistoryEntry> history =
            List.of(
                new StageHistoryEntry(
                    draft.journeyId(),
                    null,
                    JourneyStage.PROPOSED,
                    initiator,
                    JourneyTrigger.CREATED,
                    now));
        journeyRepository.appendHistory(history);
        transitions.published(inserted.get(), history);
        logger.info(
            "journey created journeyId={} initiator={} counterpart={}",
            draft.journeyId(),
            initiator,
            counterpart);
        return new JourneyCommandResult(inserted.get(), CommandOutcome.APPLIED);
      }
      // 一意制約で負けた。勝った側が既に終端へ進んでいれば作り直す
      final Optional<JourneyRecord> winner = journeyRepository.findActiveByPair(low, high);
      if (winner.isPresent()) {
        throw new JourneyAlreadyExistsException(winner.get().journeyId());
      }
    }
    throw new JourneyStateConflictException(
        null, null, "journey creation is contended for this pair");
  }

  /** 相手からの承諾/辞退。辞退は非終端のどのステージからでも行え、Journey を終了させる。 */
  @Transactional
  public JourneyCommandResult respond(
      String journeyId, String actor, Decision decision, String reason) {
    requireId(journeyId, "journeyId");
    requireUserId(actor, "actor");
    if (decision == null) {
      throw new ValidationException("decision is required");
    }
    if (reason != null && reason.length() > MAX_REASON_LENGTH) {
      throw new ValidationException("reason must be at most " + MAX_REASON_LENGTH + " characters");
    }
    journeyRepository.lockForUpdate(journeyId);
    final JourneyCommandResult result =
        transitions.apply(
            journeyId,
            actor,
            journey ->
                decision == Decision.ACCEPT
                    ? JourneyEvent.accept(actor, Instant.now(clock))
                    : JourneyEvent.decline(actor, reason, Instant.now(clock)));
    logger.info(
        "journey decision journeyId={} actor={} decision={} outcome={} stage={}",
        journeyId,
        actor,
        decision,
        result.outcome(),
        result.journey().stage());
    return result;
  }

  public JourneyView getJourney(String journeyId, String viewer) {
    requireId(journeyId, "journeyId");
    requireUserId(viewer, "viewer");
    final JourneyRecord journey = transitions.load(journeyId);
    if (!journey.isParticipant(viewer)) {
      throw new MatchingAccessDeniedException("not a participant of journey " + journeyId);
    }
    final List<StageHistoryEntry> history = journeyRepository.findHistory(journeyId);
    return new JourneyView(
        journey,
        history,
        StageDurations.compute(history, Instant.now(clock)),
        meetingRequestRepository.findByJourney(journeyId));
  }

  /** stage が null なら全ステージ。本人の Journey だけを参照できる。 */
  public List<JourneyRecord> listJourneys(String userId, JourneyStage stage, String viewer) {
    requireUserId(userId, "userId");
    requireSelf(userId, viewer);
    return journeyRepository.findByParticipant(userId, stage);
  }

  /**
   * 役割: 会話中の Journey に会議を提案する。
   * 動作: Journey を MEETING_PROPOSED へ進めてから応答待ちの会議を登録する。どちらかが失敗すれば両方戻る。
   * 前提: 提案日時は未来であること。
   */
  @Transactional
  public MeetingCommandResult proposeMeeting(
      String journeyId, String actor, Instant proposedTime, String location) {
    requireId(journeyId, "journeyId");
    requireUserId(actor, "actor");
    final Instant now = Instant.now(clock);
    if (proposedTime == null || !proposedTime.isAfter(now)) {
      throw new ValidationException("proposed_time must be in the future");
    }
    if (location == null || location.isBlank()) {
      throw new ValidationException("location is required");
    }
    if (location.length() > MAX_LOCATION_LENGTH) {
      throw new ValidationException(
          "location must be at most " + MAX_LOCATION_LENGTH + " characters");
    }
    journeyRepository.lockForUpdate(journeyId);
    final JourneyCommandResult advanced =
        transitions.apply(
            journeyId, actor, journey -> JourneyEvent.proposeMeeting(actor, proposedTime, now));
    final MeetingRequestRecord draft =
        new MeetingRequestRecord(
            UUID.randomUUID().toString(),
            journeyId,
            actor,
            proposedTime,
            location.trim(),
            MeetingStatus.PENDING,
            now.plus(properties.meetingResponseTimeout()),
            null,
            null,
            null,
            now);
    final MeetingRequestRecord meeting =
        meetingRequestRepository
            .insertIfNoneOpen(draft)
            .orElseThrow(
                () -> new InvalidMeetingStateException("journey already has an open meeting"));
    logger.info(
        "meeting proposed journeyId={} meetingId={} proposedBy={}",
        journeyId,
        meeting.meetingId(),
        actor);
    return new MeetingCommandResult(meeting, advanced.journey(), CommandOutcome.APPLIED);
  }

  /**
   * 役割: 提案された会議に相手が応答する。
   * 動作: 同じ応答の再送は ALREADY_APPLIED。辞退すると Journey は会話へ戻り、上限を超えると EXPIRED。
   * 前提: 応答できるのは提案者ではない参加者だけで、応答期限内であること。
   */
  @Transactional
  public MeetingCommandResult respondToMeeting(String meetingId, String actor, Decision decision) {
    requireId(meetingId, "meetingId");
    requireUserId(actor, "actor");
    if (decision == null) {
      throw new ValidationException("decision is required");
    }
    final MeetingRequestRecord meeting = lockJourneyOf(meetingId);
    final JourneyRecord journey = transitions.load(meeting.journeyId());
    if (!journey.isParticipant(actor)) {
      throw new MatchingAccessDeniedException(
          "not a participant of journey " + journey.journeyId());
    }
    if (actor.equals(meeting.proposedBy())) {
      throw new MatchingAccessDeniedException("only the invited participant can respond");
    }
    final MeetingStatus target =
        decision == Decision.ACCEPT ? MeetingStatus.ACCEPTED : MeetingStatus.DECLINED;
    if (meeting.status() == target) {
      return new MeetingCommandResult(meeting, journey, CommandOutcome.ALREADY_APPLIED);
    }
    if (meeting.status() != MeetingStatus.PENDING) {
      throw new InvalidMeetingStateException("meeting is already " + meeting.status());
    }
    final Instant now = Instant.now(clock);
    if (now.isAfter(meeting.respondBy())) {
      throw new InvalidMeetingStateException("meeting response deadline has passed");
    }
    final Optional<MeetingRequestRecord> responded =
        meetingRequestRepository.transition(meetingId, MeetingStatus.PENDING, target, actor, now);
    if (responded.isEmpty()) {
      // 同時応答で先に更新された
      final MeetingRequestRecord current = loadMeeting(meetingId);
      if (current.status() == target) {
        return new MeetingCommandResult(
            current, transitions.load(journey.journeyId()), CommandOutcome.ALREADY_APPLIED);
      }
      throw new InvalidMeetingStateException("meeting is already " + current.status());
    }
    final JourneyCommandResult result =
        transitions.apply(
            journey.journeyId(),
            actor,
            current ->
                target == MeetingStatus.ACCEPTED
                    ? JourneyEvent.meetingAccepted(actor, meeting.proposedTime(), now)
                    : JourneyEvent.meetingDeclined(actor, now));
    logger.info(
        "meeting response meetingId={} actor={} decision={} journeyStage={}",
        meetingId,
        actor,
        decision,
        result.journey().stage());
    return new MeetingCommandResult(responded.get(), result.journey(), CommandOutcome.APPLIED);
  }

  /** 確定済みの会議を完了にする。開始時刻前は完了にできない。 */
  @Transactional
  public MeetingCommandResult completeMeeting(String meetingId, String actor) {
    requireId(meetingId, "meetingId");
    requireUserId(actor, "actor");
    final MeetingRequestRecord meeting = lockJourneyOf(meetingId);
    final JourneyRecord journey = transitions.load(meeting.journeyId());
    if (!journey.isParticipant(actor)) {
      throw new MatchingAccessDeniedException(
          "not a participant of journey " + journey.journeyId());
    }
    if (meeting.status() == MeetingStatus.COMPLETED) {
      return new MeetingCommandResult(meeting, journey, CommandOutcome.ALREADY_APPLIED);
    }
    if (meeting.status() != MeetingStatus.ACCEPTED) {
      throw new InvalidMeetingStateException("meeting is " + meeting.status());
    }
    final Instant now = Instant.now(clock);
    if (now.isBefore(meeting.proposedTime())) {
      throw new InvalidMeetingStateException("meeting has not started yet");
    }
    final MeetingRequestRecord completed =
        meetingRequestRepository
            .transition(meetingId, MeetingStatus.ACCEPTED, MeetingStatus.COMPLETED, actor, now)
            .orElse(null);
    if (completed == null) {
      final MeetingRequestRecord current = loadMeeting(meetingId);
      if (current.status() == MeetingStatus.COMPLETED) {
        return new MeetingCommandResult(
            current, transitions.load(journey.journeyId()), CommandOutcome.ALREADY_APPLIED);
      }
      throw new InvalidMeetingStateException("meeting is " + current.status());
    }
    final JourneyCommandResult result =
        transitions.apply(
            journey.journeyId(), actor, current -> JourneyEvent.meetingCompleted(actor, now));
    return new MeetingCommandResult(completed, result.journey(), CommandOutcome.APPLIED);
  }

  /**
   * 役割: 期限切れの Journey を 1 件処理する。
   * 動作: ステージに応じたシステムイベントを 1 回だけ比較交換する。負けた場合や期限が延びていた場合は何もしない。
   * 前提: snapshot は期限切れ一覧から読んだ時点の状態。
   */
  @Transactional
  public SweepOutcome applyDeadline(JourneyRecord snapshot) {
    journeyRepository.lockForUpdate(snapshot.journeyId());
    final Instant now = Instant.now(clock);
    final JourneyEvent event = deadlineEventFor(snapshot, now);
    final TransitionResult result = stateMachine.apply(snapshot, event);
    if (result.kind() == TransitionResult.Kind.ALREADY_APPLIED) {
      return SweepOutcome.ALREADY_APPLIED;
    }
    if (result.kind() == TransitionResult.Kind.REJECTED) {
      return SweepOutcome.SKIPPED;
    }
    final Optional<JourneyRecord> written = transitions.write(result.update());
    if (written.isEmpty()) {
      return SweepOutcome.CONFLICT;
    }
    settleMeeting(snapshot, event, now);
    logger.info(
        "journey deadline applied journeyId={} from={} to={}",
        snapshot.journeyId(),
        snapshot.stage(),
        written.get().stage());
    return SweepOutcome.TRANSITIONED;
  }

  // 会議の journey_id は変わらないため、ロックを取ってから会議を読み直して判定に使う
  private MeetingRequestRecord lockJourneyOf(String meetingId) {
    journeyRepository.lockForUpdate(loadMeeting(meetingId).journeyId());
    return loadMeeting(meetingId);
  }

  private JourneyEvent deadlineEventFor(JourneyRecord journey, Instant now) {
    return switch (journey.stage()) {
      case MEETING_PROPOSED -> JourneyEvent.meetingExpired(now);
      case MEETING_CONFIRMED -> JourneyEvent.meetingCompleted(JourneyEvent.SYSTEM_ACTOR, now);
      case POST_MEETING_FEEDBACK ->
          hasFeedback(journey)
              ? JourneyEvent.feedbackCompleted(JourneyEvent.SYSTEM_ACTOR, now)
              : JourneyEvent.deadlineExpired(now);
      default -> JourneyEvent.deadlineExpired(now);
    };
  }

  // Journey 側の遷移に合わせて会議の状態を閉じる
  private void settleMeeting(JourneyRecord snapshot, JourneyEvent event, Instant now) {
    if (event.type() == JourneyEvent.Type.MEETING_EXPIRED) {
      meetingRequestRepository
          .findOpenByJourney(snapshot.journeyId())
          .filter(meeting -> meeting.status() == MeetingStatus.PENDING)
          .ifPresent(
              meeting ->
                  meetingRequestRepository.transition(
                      meeting.meetingId(),
                      MeetingStatus.PENDING,
                      MeetingStatus.EXPIRED,
                      JourneyEvent.SYSTEM_ACTOR,
                      now));
    } else if (event.type() == JourneyEvent.Type.MEETING_COMPLETED) {
      meetingRequestRepository
          .findOpenByJourney(snapshot.journeyId())
          .filter(meeting -> meeting.status() == MeetingStatus.ACCEPTED)
          .ifPresent(
              meeting ->
                  meetingRequestRepository.transition(
                      meeting.meetingId(),
                      MeetingStatus.ACCEPTED,
                      MeetingStatus.COMPLETED,
                      JourneyEvent.SYSTEM_ACTOR,
                      now));
    }
  }

  private boolean hasFeedback(JourneyRecord journey) {
    return latestCompletedMeeting(journey.journeyId())
        .map(meeting -> !feedbackRepository.findByMeeting(meeting.meetingId()).isEmpty())
        .orElse(false);
  }

  private Optional<MeetingRequestRecord> latestCompletedMeeting(String journeyId) {
    final List<MeetingRequestRecord> meetings = meetingRequestRepository.findByJourney(journeyId);
    for (int i = meetings.size() - 1; i >= 0; i--) {
      if (meetings.get(i).status() == MeetingStatus.COMPLETED) {
        return Optional.of(meetings.get(i));
      }
    }
    return Optional.empty();
  }

  private MeetingRequestRecord loadMeeting(String meetingId) {
    return meetingRequestRepository
        .findById(meetingId)
        .orElseThrow(() -> new MeetingRequestNotFoundException(meetingId));
  }

  private void requireSelf(String userId, String viewer) {
    if (viewer == null || !viewer.equals(userId)) {
      throw new MatchingAccessDeniedException("users can only read their own journeys");
    }
  }

  private void requireUserId(String userId, String name) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException(name + " is required");
    }
  }

  private void requireId(String id, String name) {
    if (id == null || id.isBlank()) {
      throw new ValidationException(name + " is required");
    }
  }
}
