package com.ryvin.matching.journey;

import java.time.Instant;

/**
 * Journey に対する入力イベント。
 *
 * @param meetingTime PROPOSE_MEETING / MEETING_ACCEPTED の会議予定時刻。他のイベントでは null。
 * @param reason DECLINE の任意の理由。
 */
public record JourneyEvent(
    Type type, String actor, Instant at, Instant meetingTime, String reason) {

  public static final String SYSTEM_ACTOR = "system";

  public enum Type {
    ACCEPT,
    DECLINE,
    PROPOSE_MEETING,
    MEETING_ACCEPTED,
    MEETING_DECLINED,
    MEETING_EXPIRED,
    MEETING_COMPLETED,
    FEEDBACK_COMPLETED,
    DEADLINE_EXPIRED
  }

  public static JourneyEvent accept(String actor, Instant at) {
    return new JourneyEvent(Type.ACCEPT, actor, at, null, null);
  }

  public static JourneyEvent decline(String actor, String reason, Instant at) {
    return new JourneyEvent(Type.DECLINE, actor, at, null, reason);
  }

  public static JourneyEvent proposeMeeting(String actor, Instant meetingTime, Instant at) {
    return new JourneyEvent(Type.PROPOSE_MEETING, actor, at, meetingTime, null);
  }

  public static JourneyEvent meetingAccepted(String actor, Instant meetingTime, Instant at) {
    return new JourneyEvent(Type.MEETING_ACCEPTED, actor, at, meetingTime, null);
  }

  public static JourneyEvent meetingDeclined(String actor, Instant at) {
    return new JourneyEvent(Type.MEETING_DECLINED, actor, at, null, null);
  }

  public static JourneyEvent meetingExpired(Instant at) {
    return new JourneyEvent(Type.MEETING_EXPIRED, SYSTEM_ACTOR, at, null, null);
  }

  public static JourneyEvent meetingCompleted(String actor, Instant at) {
    return new JourneyEvent(Type.MEETING_COMPLETED, actor, at, null, null);
  }

  public static JourneyEvent feedbackCompleted(String actor, Instant at) {
    return new JourneyEvent(Type.FEEDBACK_COMPLETED, actor, at, null, null);
  }

  public static JourneyEvent deadlineExpired(Instant at) {
    return new JourneyEvent(Type.DEADLINE_EXPIRED, SYSTEM_ACTOR, at, null, null);
  }
}
