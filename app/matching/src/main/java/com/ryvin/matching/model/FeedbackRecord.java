package com.ryvin.matching.model;

import java.time.Instant;

public record FeedbackRecord(
    String feedbackId,
    String meetingId,
    String journeyId,
    String submittedBy,
    String aboutUserId,
    int rating,
    String comment,
    boolean wantsToContinue,
    Instant submittedAt) {}
