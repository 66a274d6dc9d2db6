package com.ryvin.matching.api;

import com.ryvin.matching.api.request.SubmitResponsesRequest;
import com.ryvin.matching.api.response.MissingFieldsResponse;
import com.ryvin.matching.api.response.UserResponsesResponse;
import com.ryvin.matching.service.QuestionnaireService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}/responses")
@RequiredArgsConstructor
public class UserResponseController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final QuestionnaireService questionnaireService;

  @PutMapping
  public UserResponsesResponse submitAnswers(
      @PathVariable("userId") String userId,
      @RequestHeader(HEADER_USER_ID) String requester,
      @Valid @RequestBody SubmitResponsesRequest request) {
    requireSelf(userId, requester);
    return UserResponsesResponse.from(
        questionnaireService.submitAnswers(userId, request.answers()));
  }

  @GetMapping
  public UserResponsesResponse getAnswers(
      @PathVariable("userId") String userId, @RequestHeader(HEADER_USER_ID) String requester) {
    requireSelf(userId, requester);
    return UserResponsesResponse.from(questionnaireService.getAnswers(userId));
  }

  @GetMapping("/missing")
  public MissingFieldsResponse getMissing(
      @PathVariable("userId") String userId, @RequestHeader(HEADER_USER_ID) String requester) {
    requireSelf(userId, requester);
    final List<String> missing = questionnaireService.missingRequiredFields(userId);
    return new MissingFieldsResponse(userId, missing, missing.isEmpty());
  }

  private void requireSelf(String userId, String requester) {
    if (!userId.equals(requester)) {
      throw new MatchingAccessDeniedException("users can only access their own responses");
    }
  }
}
