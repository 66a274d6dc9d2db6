package com.ryvin.matching.repository;

import com.ryvin.matching.journey.JourneyUpdate;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.StageHistoryEntry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Journey と stage_history の永続化。
 *
 * <p>実装は次の 2 点を保証すること。
 * 非終端の Journey は参加者の組ごとに 1 件まで ({@link #insertIfNoActive})。
 * ステージ更新は (journey_id, 期待ステージ, 期待 version) の比較交換でのみ行う ({@link #compareAndSet})。
 */
public interface JourneyRepository {

  /**
   * 役割: 新しい Journey を登録する。
   * 動作: 同じ組に非終端の Journey が既にあれば何もせず空を返す。
   * 前提: record の参加者は low < high に正規化済み。
   */
  Optional<JourneyRecord> insertIfNoActive(JourneyRecord record);

  Optional<JourneyRecord> findById(String journeyId);

  Optional<JourneyRecord> findActiveByPair(String participantLow, String participantHigh);

  /**
   * 役割: 期待した状態のときだけ更新を適用する。
   * 動作: 一致すれば version を 1 進めた新しい状態を返し、不一致なら空を返す。
   * 前提: なし。
   */
  Optional<JourneyRecord> compareAndSet(JourneyUpdate update);

  void appendHistory(List<StageHistoryEntry> entries);

  List<StageHistoryEntry> findHistory(String journeyId);

  /** stage が null なら全ステージ。更新の新しい順。 */
  List<JourneyRecord> findByParticipant(String userId, JourneyStage stage);

  Set<String> findActivePartners(String userId);

  Set<String> findDeclinedPartnersSince(String userId, Instant since);

  /** 期限を過ぎた非終端 Journey を期限の古い順に返す。 */
  List<JourneyRecord> findOverdue(Instant now, int limit);

  /** 同じ Journey に対する変更をトランザクション終了まで直列化する。 */
  void lockForUpdate(String journeyId);
}
