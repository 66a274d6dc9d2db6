package com.ryvin.matching.api;

import com.ryvin.matching.api.request.MeetingDecisionRequest;
import com.ryvin.matching.api.request.SubmitFeedbackRequest;
import com.ryvin.matching.api.response.FeedbackSubmissionResponse;
import com.ryvin.matching.api.response.MeetingCommandResponse;
import com.ryvin.matching.model.Decision;
import com.ryvin.matching.service.FeedbackService;
import com.ryvin.matching.service.JourneyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/meetings/{meetingId}")
@RequiredArgsConstructor
public class MeetingController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final JourneyService journeyService;
  private final FeedbackService feedbackService;

  @PostMapping("/decisions")
  public MeetingCommandResponse decide(
      @PathVariable("meetingId") String meetingId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody MeetingDecisionRequest request) {
    return MeetingCommandResponse.from(
        journeyService.respondToMeeting(meetingId, userId, Decision.fromValue(request.decision())));
  }

  @PostMapping("/completion")
  public MeetingCommandResponse complete(
      @PathVariable("meetingId") String meetingId, @RequestHeader(HEADER_USER_ID) String userId) {
    return MeetingCommandResponse.from(journeyService.completeMeeting(meetingId, userId));
  }

  @PostMapping("/feedback")
  public ResponseEntity<FeedbackSubmissionResponse> submitFeedback(
      @PathVariable("meetingId") String meetingId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody SubmitFeedbackRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            FeedbackSubmissionResponse.from(
                feedbackService.submit(
                    meetingId,
                    userId,
                    request.rating(),
                    request.comment(),
                    Boolean.TRUE.equals(request.wantsToContinue()))));
  }
}
