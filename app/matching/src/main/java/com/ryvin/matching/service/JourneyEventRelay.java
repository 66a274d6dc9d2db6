/*
 * どこで: Matching 通知
 * 何を: ステージ遷移を遷移と同じトランザクションで outbox へ書き出す
 * なぜ: 送信先の遅延や障害でコマンドを待たせず、ロールバックした遷移を通知しないため
 */
package com.ryvin.matching.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryvin.common.event.JourneyEventPayload;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.StageHistoryEntry;
import com.ryvin.matching.repository.JourneyOutboxRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class JourneyEventRelay {

  static final String EVENT_TYPE = "JourneyStageChanged";

  private final JourneyOutboxRepository outboxRepository;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public JourneyEventRelay(JourneyOutboxRepository outboxRepository, ObjectMapper objectMapper) {
    this.outboxRepository = outboxRepository;
    this.objectMapper = objectMapper;
  }

  /** コミット直前に呼ばれる。ここで失敗すると遷移ごとロールバックされる。 */
  @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT, fallbackExecution = true)
  public void onTransition(JourneyTransitionedEvent event) {
    for (StageHistoryEntry entry : event.transitions()) {
      final JourneyEventPayload payload = toPayload(event, entry);
      outboxRepository.insert(
          UUID.fromString(payload.eventId()),
          payload.eventType(),
          payload.journeyId(),
          serialize(payload),
          entry.occurredAt());
    }
  }

  static JourneyEventPayload toPayload(JourneyTransitionedEvent event, StageHistoryEntry entry) {
    final JourneyRecord journey = event.journey();
    return new JourneyEventPayload(
        UUID.randomUUID().toString(),
        EVENT_TYPE,
        entry.occurredAt().toString(),
        journey.journeyId(),
        journey.participants(),
        entry.fromStage() == null ? null : entry.fromStage().name(),
        entry.stage().name(),
        entry.trigger().name(),
        entry.actor(),
        journey.version(),
        event.traceId());
  }

  private String serialize(JourneyEventPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("journey event serialization failed", ex);
    }
  }
}
