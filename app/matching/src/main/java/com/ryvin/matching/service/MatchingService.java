/*
 * どこで: Matching サービス層
 * 何を: 候補ランキングと Journey 作成前の適格性判定を行う
 * なぜ: ランキングと Journey 作成で同じ除外規則を適用するため
 */
package com.ryvin.matching.service;

import com.ryvin.matching.api.NotEligibleException;
import com.ryvin.matching.api.UserProfileNotFoundException;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.config.JourneyProperties;
import com.ryvin.matching.config.MatchingScoringProperties;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.model.UserProfile;
import com.ryvin.matching.repository.JourneyRepository;
import com.ryvin.matching.scoring.CandidateRanker;
import com.ryvin.matching.scoring.EligibilityFilter;
import com.ryvin.matching.scoring.ExclusionReason;
import com.ryvin.matching.scoring.RankedCandidate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchingService {

  private final ProfileDirectory profileDirectory;
  private final JourneyRepository journeyRepository;
  private final ScoringService scoringService;
  private final CandidateRanker candidateRanker;
  private final MatchingScoringProperties scoringProperties;
  private final JourneyProperties journeyProperties;
  private final MatchingMetrics metrics;
  private final Clock clock;

  public List<RankedCandidate> rankCandidates(String userId, Integer limit) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("userId is required");
    }
    final int resolvedLimit = resolveLimit(limit);
    final UserProfile seeker = requireProfile(userId);
    final EligibilityFilter filter = eligibilityFilterFor(seeker);
    final List<UserProfile> pool =
        profileDirectory.findCandidatePool(userId, scoringProperties.candidatePoolSize());
    final long started = System.nanoTime();
    final List<RankedCandidate> ranked =
        candidateRanker
            .rank(
                filter,
                pool,
                scoringService.scorerFor(userId, pool.stream().map(UserProfile::userId).toList()))
            .limit(resolvedLimit)
            .toList();
    metrics.recordRank(Duration.ofNanos(System.nanoTime() - started), ranked.size());
    return ranked;
  }

  /**
   * 役割: 2 人の間で Journey を始めてよいか判定する。
   * 動作: 本人/認証/クールダウン/相互条件と、致命的な不一致を確認する。足切りスコアは適用しない。
   * 前提: 進行中 Journey の重複は呼び出し側で AlreadyExists として扱う。
   */
  public void requireEligiblePair(String initiator, String counterpart) {
    final UserProfile seeker = requireProfile(initiator);
    final UserProfile candidate = requireProfile(counterpart);
    final Optional<ExclusionReason> excluded =
        eligibilityFilterFor(seeker).checkPairing(candidate);
    if (excluded.isPresent()) {
      throw new NotEligibleException(excluded.get());
    }
    final CompatibilityScore score = scoringService.score(initiator, counterpart);
    if (score.dealBreakerFailed()) {
      throw new NotEligibleException(ExclusionReason.DEAL_BREAKER);
    }
  }

  EligibilityFilter eligibilityFilterFor(UserProfile seeker) {
    final Instant cooldownStart = Instant.now(clock).minus(journeyProperties.declineCooldown());
    return new EligibilityFilter(
        seeker,
        journeyRepository.findActivePartners(seeker.userId()),
        journeyRepository.findDeclinedPartnersSince(seeker.userId(), cooldownStart),
        scoringProperties.requireVerified(),
        scoringProperties.minimumScore());
  }

  private UserProfile requireProfile(String userId) {
    return profileDirectory
        .findProfile(userId)
        .orElseThrow(() -> new UserProfileNotFoundException(userId));
  }

  private int resolveLimit(Integer limit) {
    if (limit == null) {
      return scoringProperties.defaultCandidateLimit();
    }
    if (limit < 1) {
      throw new ValidationException("limit must be positive");
    }
    return Math.min(limit, scoringProperties.maxCandidateLimit());
  }
}
