/*
 * どこで: Matching サービス層
 * 何を: 会議後フィードバックの受付と、利用者ごとの参照/集計を提供する
 * なぜ: 両者の提出が揃った時点で Journey を ONGOING へ進め、結果をオフライン分析に残すため
 */
package com.ryvin.matching.service;

import com.ryvin.matching.api.DuplicateFeedbackException;
import com.ryvin.matching.api.InvalidMeetingStateException;
import com.ryvin.matching.api.MatchingAccessDeniedException;
import com.ryvin.matching.api.MeetingRequestNotFoundException;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.journey.JourneyEvent;
import com.ryvin.matching.model.FeedbackRecord;
import com.ryvin.matching.model.FeedbackSummary;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import com.ryvin.matching.repository.FeedbackRepository;
import com.ryvin.matching.repository.JourneyRepository;
import com.ryvin.matching.repository.MeetingRequestRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class FeedbackService {

  private static final Logger logger = LoggerFactory.getLogger(FeedbackService.class);
  private static final int MIN_RATING = 1;
  private static final int MAX_RATING = 5;
  private static final int MAX_COMMENT_LENGTH = 1000;

  public enum Direction {
    SUBMITTED,
    RECEIVED;

    public static Direction fromValue(String value) {
      if (value == null || value.isBlank()) {
        return SUBMITTED;
      }
      for (Direction direction : values()) {
        if (direction.name().equalsIgnoreCase(value.trim())) {
          return direction;
        }
      }
      throw new ValidationException("unknown direction: " + value);
    }
  }

  private final MeetingRequestRepository meetingRequestRepository;
  private final FeedbackRepository feedbackRepository;
  private final JourneyRepository journeyRepository;
  private final JourneyTransitions transitions;
  private final JourneyMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 会議後フィードバックを 1 件受け付ける。
   * 動作: 同じ Journey への提出は行ロックで直列化する。両参加者の提出が揃えば Journey を ONGOING へ進める。
   * 前提: 会議が COMPLETED であること。提出は 1 会議 1 提出者につき 1 件まで。
   */
  @Transactional
  public FeedbackSubmission submit(
      String meetingId, String submitter, int rating, String comment, boolean wantsToContinue) {
    if (meetingId == null || meetingId.isBlank()) {
      throw new ValidationException("meetingId is required");
    }
    if (submitter == null || submitter.isBlank()) {
      throw new ValidationException("submitter is required");
    }
    if (rating < MIN_RATING || rating > MAX_RATING) {
      throw new ValidationException("rating must be between 1 and 5");
    }
    if (comment != null && comment.length() > MAX_COMMENT_LENGTH) {
      throw new ValidationException(
          "comment must be at most " + MAX_COMMENT_LENGTH + " characters");
    }
    final String journeyId = loadMeeting(meetingId).journeyId();
    journeyRepository.lockForUpdate(journeyId);
    // ロック取得後の状態で判定する
    final MeetingRequestRecord meeting = loadMeeting(meetingId);
    final JourneyRecord journey = transitions.load(journeyId);
    if (!journey.isParticipant(submitter)) {
      throw new MatchingAccessDeniedException("not a participant of journey " + journeyId);
    }
    if (meeting.status() != MeetingStatus.COMPLETED) {
      throw new InvalidMeetingStateException(
          "feedback requires a completed meeting, current=" + meeting.status());
    }
    final List<FeedbackRecord> existing = feedbackRepository.findByMeeting(meetingId);
    if (existing.stream().anyMatch(feedback -> feedback.submittedBy().equals(submitter))) {
      throw new DuplicateFeedbackException(meetingId, submitter);
    }
    final Instant now = Instant.now(clock);
    final FeedbackRecord draft =
        new FeedbackRecord(
            UUID.randomUUID().toString(),
            meetingId,
            journeyId,
            submitter,
            journey.counterpartOf(submitter),
            rating,
            comment,
            wantsToContinue,
            now);
    final FeedbackRecord saved;
    try {
      saved =
          feedbackRepository
              .insertIfAbsent(draft)
              .orElseThrow(() -> new DuplicateFeedbackException(meetingId, submitter));
    } catch (DuplicateKeyException ex) {
      throw new DuplicateFeedbackException(meetingId, submitter);
    }
    metrics.recordFeedbackSubmitted();

    final Set<String> submitters =
        feedbackRepository.findByMeeting(meetingId).stream()
            .map(FeedbackRecord::submittedBy)
            .collect(Collectors.toSet());
    JourneyRecord current = journey;
    if (submitters.containsAll(journey.participants())
        && journey.stage() == JourneyStage.POST_MEETING_FEEDBACK) {
      current =
          transitions
              .apply(journeyId, submitter, latest -> JourneyEvent.feedbackCompleted(submitter, now))
              .journey();
    }
    logger.info(
        "feedback submitted meetingId={} submitter={} journeyStage={}",
        meetingId,
        submitter,
        current.stage());
    return new FeedbackSubmission(saved, current);
  }

  public List<FeedbackRecord> listFeedback(String userId, Direction direction, String viewer) {
    requireSelf(userId, viewer);
    return direction == Direction.RECEIVED
        ? feedbackRepository.findAboutUser(userId)
        : feedbackRepository.findBySubmitter(userId);
  }

  public FeedbackSummary summarize(String userId, String viewer) {
    requireSelf(userId, viewer);
    return feedbackRepository.summarizeAbout(userId);
  }

  private MeetingRequestRecord loadMeeting(String meetingId) {
    return meetingRequestRepository
        .findById(meetingId)
        .orElseThrow(() -> new MeetingRequestNotFoundException(meetingId));
  }

  private void requireSelf(String userId, String viewer) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("userId is required");
    }
    if (viewer == null || !viewer.equals(userId)) {
      throw new MatchingAccessDeniedException("users can only read their own feedback");
    }
  }
}
