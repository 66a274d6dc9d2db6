package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.FeedbackSummary;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackSummaryResponse(
    String userId, long count, double averageRating, double continueRatio) {

  public static FeedbackSummaryResponse from(FeedbackSummary summary) {
    return new FeedbackSummaryResponse(
        summary.userId(), summary.count(), summary.averageRating(), summary.continueRatio());
  }
}
