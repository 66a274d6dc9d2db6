package com.ryvin.matching.repository;

import com.ryvin.matching.model.FeedbackRecord;
import com.ryvin.matching.model.FeedbackSummary;
import java.util.List;
import java.util.Optional;

public interface FeedbackRepository {

  /** (meeting_id, submitted_by) が既にあれば登録せず空を返す。 */
  Optional<FeedbackRecord> insertIfAbsent(FeedbackRecord record);

  List<FeedbackRecord> findByMeeting(String meetingId);

  List<FeedbackRecord> findBySubmitter(String userId);

  List<FeedbackRecord> findAboutUser(String userId);

  FeedbackSummary summarizeAbout(String userId);
}
