package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.service.FeedbackSubmission;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackSubmissionResponse(FeedbackResponse feedback, JourneyResponse journey) {

  public static FeedbackSubmissionResponse from(FeedbackSubmission submission) {
    return new FeedbackSubmissionResponse(
        FeedbackResponse.from(submission.feedback()), JourneyResponse.from(submission.journey()));
  }
}
