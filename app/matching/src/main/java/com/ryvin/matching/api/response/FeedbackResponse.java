package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.FeedbackRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackResponse(
    String feedbackId,
    String meetingId,
    String journeyId,
    String submittedBy,
    String aboutUserId,
    int rating,
    String comment,
    boolean wantsToContinue,
    String submittedAt) {

  public static FeedbackResponse from(FeedbackRecord feedback) {
    return new FeedbackResponse(
        feedback.feedbackId(),
        feedback.meetingId(),
        feedback.journeyId(),
        feedback.submittedBy(),
        feedback.aboutUserId(),
        feedback.rating(),
        feedback.comment(),
        feedback.wantsToContinue(),
        ResponseTimes.iso(feedback.submittedAt()));
  }
}
