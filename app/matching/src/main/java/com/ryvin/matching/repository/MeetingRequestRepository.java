package com.ryvin.matching.repository;

import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MeetingRequestRepository {

  /** 同じ Journey に応答待ち/確定済みの会議が既にあれば登録せず空を返す。 */
  Optional<MeetingRequestRecord> insertIfNoneOpen(MeetingRequestRecord record);

  Optional<MeetingRequestRecord> findById(String meetingId);

  Optional<MeetingRequestRecord> findOpenByJourney(String journeyId);

  List<MeetingRequestRecord> findByJourney(String journeyId);

  /**
   * 役割: 会議の状態を条件付きで更新する。
   * 動作: 現在の状態が expected のときだけ next に更新し、更新後の行を返す。不一致なら空。
   * 前提: ACCEPTED/DECLINED では応答者と応答時刻、COMPLETED では完了時刻を記録する。
   */
  Optional<MeetingRequestRecord> transition(
      String meetingId, MeetingStatus expected, MeetingStatus next, String actor, Instant at);
}
