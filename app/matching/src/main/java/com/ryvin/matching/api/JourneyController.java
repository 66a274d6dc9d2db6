/*
 * どこで: Matching API
 * 何を: Journey の作成/応答/参照と会議提案のエンドポイントを提供する
 * なぜ: 参加者の操作を X-User-Id の本人として状態機械へ渡すため
 */
package com.ryvin.matching.api;

import com.ryvin.matching.api.request.CreateJourneyRequest;
import com.ryvin.matching.api.request.JourneyDecisionRequest;
import com.ryvin.matching.api.request.ProposeMeetingRequest;
import com.ryvin.matching.api.response.JourneyCommandResponse;
import com.ryvin.matching.api.response.JourneyDetailResponse;
import com.ryvin.matching.api.response.JourneyResponse;
import com.ryvin.matching.api.response.JourneysResponse;
import com.ryvin.matching.api.response.MeetingCommandResponse;
import com.ryvin.matching.model.Decision;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.service.JourneyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/journeys")
@RequiredArgsConstructor
public class JourneyController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final JourneyService journeyService;

  @PostMapping
  public ResponseEntity<JourneyCommandResponse> create(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CreateJourneyRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            JourneyCommandResponse.from(
                journeyService.createJourney(userId, request.counterpartId())));
  }

  @GetMapping("/{journeyId}")
  public JourneyDetailResponse get(
      @PathVariable("journeyId") String journeyId, @RequestHeader(HEADER_USER_ID) String userId) {
    return JourneyDetailResponse.from(journeyService.getJourney(journeyId, userId));
  }

  @GetMapping
  public JourneysResponse list(
      @RequestParam("user_id") String userId,
      @RequestParam(value = "stage", required = false) String stage,
      @RequestHeader(HEADER_USER_ID) String requester) {
    final JourneyStage stageFilter =
        stage == null || stage.isBlank() ? null : JourneyStage.fromValue(stage);
    return new JourneysResponse(
        userId,
        journeyService.listJourneys(userId, stageFilter, requester).stream()
            .map(JourneyResponse::from)
            .toList());
  }

  @PostMapping("/{journeyId}/decisions")
  public JourneyCommandResponse decide(
      @PathVariable("journeyId") String journeyId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody JourneyDecisionRequest request) {
    return JourneyCommandResponse.from(
        journeyService.respond(
            journeyId, userId, Decision.fromValue(request.decision()), request.reason()));
  }

  @PostMapping("/{journeyId}/meetings")
  public ResponseEntity<MeetingCommandResponse> proposeMeeting(
      @PathVariable("journeyId") String journeyId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody ProposeMeetingRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            MeetingCommandResponse.from(
                journeyService.proposeMeeting(
                    journeyId, userId, request.proposedTime(), request.location())));
  }
}
