package com.ryvin.matching.api;

import com.ryvin.matching.api.response.FeedbackListResponse;
import com.ryvin.matching.api.response.FeedbackResponse;
import com.ryvin.matching.api.response.FeedbackSummaryResponse;
import com.ryvin.matching.service.FeedbackService;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}/feedback")
@RequiredArgsConstructor
public class FeedbackController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final FeedbackService feedbackService;

  @GetMapping
  public FeedbackListResponse list(
      @PathVariable("userId") String userId,
      @RequestHeader(HEADER_USER_ID) String requester,
      @RequestParam(value = "direction", required = false) String direction) {
    final FeedbackService.Direction resolved = FeedbackService.Direction.fromValue(direction);
    return new FeedbackListResponse(
        userId,
        resolved.name().toLowerCase(Locale.ROOT),
        feedbackService.listFeedback(userId, resolved, requester).stream()
            .map(FeedbackResponse::from)
            .toList());
  }

  @GetMapping("/summary")
  public FeedbackSummaryResponse summary(
      @PathVariable("userId") String userId, @RequestHeader(HEADER_USER_ID) String requester) {
    return FeedbackSummaryResponse.from(feedbackService.summarize(userId, requester));
  }
}
