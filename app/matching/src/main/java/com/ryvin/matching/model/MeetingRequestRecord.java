package com.ryvin.matching.model;

import java.time.Instant;

public record MeetingRequestRecord(
    String meetingId,
    String journeyId,
    String proposedBy,
    Instant proposedTime,
    String location,
    MeetingStatus status,
    Instant respondBy,
    String respondedBy,
    Instant respondedAt,
    Instant completedAt,
    Instant createdAt) {}
