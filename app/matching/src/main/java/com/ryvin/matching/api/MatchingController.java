/*
 * どこで: Matching API
 * 何を: 2 ユーザー間のスコアと候補ランキングのエンドポイントを提供する
 * なぜ: 採点とランキングを副作用の無い参照 API として公開するため
 */
package com.ryvin.matching.api;

import com.ryvin.matching.api.response.CandidatesResponse;
import com.ryvin.matching.api.response.CompatibilityScoreResponse;
import com.ryvin.matching.api.response.PairScoreResponse;
import com.ryvin.matching.service.MatchingService;
import com.ryvin.matching.service.ScoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matching")
@RequiredArgsConstructor
public class MatchingController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final ScoringService scoringService;
  private final MatchingService matchingService;

  @GetMapping("/scores")
  public PairScoreResponse score(
      @RequestParam("user_a") String userA,
      @RequestParam("user_b") String userB,
      @RequestHeader(HEADER_USER_ID) String requester) {
    if (!requester.equals(userA) && !requester.equals(userB)) {
      throw new MatchingAccessDeniedException("requester must be one of the scored users");
    }
    return new PairScoreResponse(
        userA, userB, CompatibilityScoreResponse.from(scoringService.score(userA, userB)));
  }

  @GetMapping("/users/{userId}/candidates")
  public CandidatesResponse candidates(
      @PathVariable("userId") String userId,
      @RequestHeader(HEADER_USER_ID) String requester,
      @RequestParam(value = "limit", required = false) Integer limit) {
    if (!userId.equals(requester)) {
      throw new MatchingAccessDeniedException("users can only rank their own candidates");
    }
    return CandidatesResponse.from(userId, matchingService.rankCandidates(userId, limit));
  }
}
