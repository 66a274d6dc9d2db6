package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.MeetingRequestRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeetingResponse(
    String meetingId,
    String journeyId,
    String proposedBy,
    String proposedTime,
    String location,
    String status,
    String respondBy,
    String respondedBy,
    String respondedAt,
    String completedAt,
    String createdAt) {

  public static MeetingResponse from(MeetingRequestRecord meeting) {
    return new MeetingResponse(
        meeting.meetingId(),
        meeting.journeyId(),
        meeting.proposedBy(),
        ResponseTimes.iso(meeting.proposedTime()),
        meeting.location(),
        meeting.status().name(),
        ResponseTimes.iso(meeting.respondBy()),
        meeting.respondedBy(),
        ResponseTimes.iso(meeting.respondedAt()),
        ResponseTimes.iso(meeting.completedAt()),
        ResponseTimes.iso(meeting.createdAt()));
  }
}
