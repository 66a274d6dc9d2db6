/*
 * どこで: Matching サービス層
 * 何を: 状態機械の判定結果を比較交換で書き込み、履歴/メトリクス/通知を揃えて反映する
 * なぜ: 利用者操作と期限スイープが同じ書き込み手順を通るようにするため
 */
package com.ryvin.matching.service;

import com.ryvin.common.TraceIds;
import com.ryvin.matching.api.JourneyNotFoundException;
import com.ryvin.matching.api.JourneyStateConflictException;
import com.ryvin.matching.api.MatchingAccessDeniedException;
import com.ryvin.matching.config.JourneyProperties;
import com.ryvin.matching.journey.JourneyEvent;
import com.ryvin.matching.journey.JourneyStateMachine;
import com.ryvin.matching.journey.JourneyUpdate;
import com.ryvin.matching.journey.TransitionResult;
import com.ryvin.matching.model.CommandOutcome;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import com.ryvin.matching.model.StageHistoryEntry;
import com.ryvin.matching.repository.JourneyRepository;
import com.ryvin.matching.repository.MeetingRequestRepository;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
class JourneyTransitions {

  private static final Logger logger = LoggerFactory.getLogger(JourneyTransitions.class);

  private final JourneyRepository journeyRepository;
  private final MeetingRequestRepository meetingRequestRepository;
  private final JourneyStateMachine stateMachine;
  private final JourneyProperties properties;
  private final JourneyMetrics metrics;
  private final ApplicationEventPublisher eventPublisher;

  /**
   * 役割: 参加者の操作を Journey に適用する。
   * 動作: 最新状態を読み、状態機械で判定して比較交換する。競合に負けたら読み直して再判定する。
   * 前提: participant が null でなければ参加者本人であることを確認する。呼び出し側のトランザクション内で使う。
   */
  JourneyCommandResult apply(
      String journeyId, String participant, Function<JourneyRecord, JourneyEvent> eventFor) {
    JourneyRecord journey = null;
    for (int attempt = 1; attempt <= properties.casMaxAttempts(); attempt++) {
      journey = load(journeyId);
      if (participant != null && !journey.isParticipant(participant)) {
        throw new MatchingAccessDeniedException("not a participant of journey " + journeyId);
      }
      final TransitionResult result = stateMachine.apply(journey, eventFor.apply(journey));
      switch (result.kind()) {
        case ALREADY_APPLIED:
          return new JourneyCommandResult(journey, CommandOutcome.ALREADY_APPLIED);
        case REJECTED:
          throw new JourneyStateConflictException(journeyId, journey.stage(), result.rejection());
        default:
          break;
      }
      final Optional<JourneyRecord> written = write(result.update());
      if (written.isPresent()) {
        return new JourneyCommandResult(written.get(), CommandOutcome.APPLIED);
      }
      logger.info(
          "journey update lost race journeyId={} attempt={} expectedVersion={}",
          journeyId,
          attempt,
          journey.version());
    }
    throw new JourneyStateConflictException(
        journeyId,
        journey == null ? null : journey.stage(),
        "journey is being updated concurrently");
  }

  /**
   * 1 回だけ比較交換する。成功時は履歴を追記し、終端に入った場合は未完了の会議も閉じる。
   * 負けた場合は何も書かずに空を返す。遷移グラフに無い履歴を含む更新は書かずに例外にする。
   */
  Optional<JourneyRecord> write(JourneyUpdate update) {
    requireAllowedTransitions(update);
    final Optional<JourneyRecord> written = journeyRepository.compareAndSet(update);
    if (written.isEmpty()) {
      metrics.recordCasConflict();
      return written;
    }
    journeyRepository.appendHistory(update.history());
    if (update.newStage().terminal()) {
      closeOpenMeeting(written.get());
    }
    published(written.get(), update.history());
    return written;
  }

  void published(JourneyRecord journey, List<StageHistoryEntry> history) {
    for (StageHistoryEntry entry : history) {
      metrics.recordTransition(entry.fromStage(), entry.stage(), entry.trigger());
    }
    eventPublisher.publishEvent(
        new JourneyTransitionedEvent(journey, history, TraceIds.currentOrNew()));
  }

  // 履歴は expectedStage から newStage まで、グラフの辺だけで繋がっていること
  private static void requireAllowedTransitions(JourneyUpdate update) {
    JourneyStage current = update.expectedStage();
    for (StageHistoryEntry entry : update.history()) {
      if (entry.fromStage() != current || !current.canTransitionTo(entry.stage())) {
        throw new IllegalStateException(
            "illegal stage transition journeyId="
                + update.journeyId()
                + " from="
                + entry.fromStage()
                + " to="
                + entry.stage()
                + " expected="
                + current);
      }
      current = entry.stage();
    }
    if (current != update.newStage()) {
      throw new IllegalStateException(
          "stage history does not end at new stage journeyId="
              + update.journeyId()
              + " last="
              + current
              + " newStage="
              + update.newStage());
    }
  }

  JourneyRecord load(String journeyId) {
    return journeyRepository
        .findById(journeyId)
        .orElseThrow(() -> new JourneyNotFoundException(journeyId));
  }

  private void closeOpenMeeting(JourneyRecord journey) {
    final Optional<MeetingRequestRecord> open =
        meetingRequestRepository.findOpenByJourney(journey.journeyId());
    if (open.isEmpty()) {
      return;
    }
    final MeetingRequestRecord meeting = open.get();
    meetingRequestRepository.transition(
        meeting.meetingId(),
        meeting.status(),
        MeetingStatus.EXPIRED,
        journey.endedBy(),
        journey.updatedAt());
  }
}
