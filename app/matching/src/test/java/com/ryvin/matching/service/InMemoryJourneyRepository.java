package com.ryvin.matching.service;

import com.ryvin.matching.journey.JourneyUpdate;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.StageHistoryEntry;
import com.ryvin.matching.repository.JourneyRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 部分一意インデックスと比較交換を同期化で再現するテスト用リポジトリ。
 */
class InMemoryJourneyRepository implements JourneyRepository {

  private final Map<String, JourneyRecord> journeys = new LinkedHashMap<>();
  private final List<StageHistoryEntry> history = new ArrayList<>();
  // 行ロックと比較交換の呼び出し順を記録する
  private final List<String> operations = new ArrayList<>();

  @Override
  public synchronized Optional<JourneyRecord> insertIfNoActive(JourneyRecord record) {
    if (findActiveByPair(record.participantLow(), record.participantHigh()).isPresent()) {
      return Optional.empty();
    }
    journeys.put(record.journeyId(), record);
    return Optional.of(record);
  }

  @Override
  public synchronized Optional<JourneyRecord> findById(String journeyId) {
    return Optional.ofNullable(journeys.get(journeyId));
  }

  @Override
  public synchronized Optional<JourneyRecord> findActiveByPair(String low, String high) {
    return journeys.values().stream()
        .filter(journey -> journey.participantLow().equals(low))
        .filter(journey -> journey.participantHigh().equals(high))
        .filter(journey -> !journey.stage().terminal())
        .findFirst();
  }

  @Override
  public synchronized Optional<JourneyRecord> compareAndSet(JourneyUpdate update) {
    operations.add("cas:" + update.journeyId());
    final JourneyRecord current = journeys.get(update.journeyId());
    if (current == null
        || current.stage() != update.expectedStage()
        || current.version() != update.expectedVersion()) {
      return Optional.empty();
    }
    final JourneyRecord next =
        new JourneyRecord(
            current.journeyId(),
            current.participantLow(),
            current.participantHigh(),
            current.initiator(),
            update.newStage(),
            current.version() + 1,
            update.consent(),
            update.deadline(),
            update.failedMeetingAttempts(),
            update.endedBy(),
            update.endReason(),
            current.createdAt(),
            update.updatedAt());
    journeys.put(next.journeyId(), next);
    return Optional.of(next);
  }

  @Override
  public synchronized void appendHistory(List<StageHistoryEntry> entries) {
    history.addAll(entries);
  }

  @Override
  public synchronized List<StageHistoryEntry> findHistory(String journeyId) {
    return history.stream().filter(entry -> entry.journeyId().equals(journeyId)).toList();
  }

  @Override
  public synchronized List<JourneyRecord> findByParticipant(String userId, JourneyStage stage) {
    return journeys.values().stream()
        .filter(journey -> journey.isParticipant(userId))
        .filter(journey -> stage == null || journey.stage() == stage)
        .sorted(Comparator.comparing(JourneyRecord::updatedAt).reversed())
        .toList();
  }

  @Override
  public synchronized Set<String> findActivePartners(String userId) {
    final Set<String> partners = new LinkedHashSet<>();
    for (JourneyRecord journey : journeys.values()) {
      if (journey.isParticipant(userId) && !journey.stage().terminal()) {
        partners.add(journey.counterpartOf(userId));
      }
    }
    return partners;
  }

  @Override
  public synchronized Set<String> findDeclinedPartnersSince(String userId, Instant since) {
    final Set<String> partners = new LinkedHashSet<>();
    for (JourneyRecord journey : journeys.values()) {
      if (journey.isParticipant(userId)
          && journey.stage() == JourneyStage.DECLINED
          && !journey.updatedAt().isBefore(since)) {
        partners.add(journey.counterpartOf(userId));
      }
    }
    return partners;
  }

  @Override
  public synchronized List<JourneyRecord> findOverdue(Instant now, int limit) {
    return journeys.values().stream()
        .filter(journey -> !journey.stage().terminal())
        .filter(journey -> journey.deadline() != null && !journey.deadline().isAfter(now))
        .sorted(Comparator.comparing(JourneyRecord::deadline))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized void lockForUpdate(String journeyId) {
    // 排他は比較交換に任せ、呼ばれた順序だけを残す
    operations.add("lock:" + journeyId);
  }

  synchronized List<String> operations() {
    return List.copyOf(operations);
  }

  synchronized void clearOperations() {
    operations.clear();
  }

  synchronized List<StageHistoryEntry> allHistory() {
    return List.copyOf(history);
  }

  synchronized int size() {
    return journeys.size();
  }
}
