package com.ryvin.matching.model;

/** stage_history に記録する遷移の契機。 */
public enum JourneyTrigger {
  CREATED,
  ACCEPTED,
  DECLINED,
  AUTO_ADVANCED,
  MEETING_PROPOSED,
  MEETING_ACCEPTED,
  MEETING_DECLINED,
  MEETING_EXPIRED,
  MEETING_COMPLETED,
  FEEDBACK_COMPLETED,
  DEADLINE_EXPIRED
}
