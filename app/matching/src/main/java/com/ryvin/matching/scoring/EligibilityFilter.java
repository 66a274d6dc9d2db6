/*
 * どこで: Matching スコアリング
 * 何を: 候補ユーザーの除外規則をまとめる
 * なぜ: ランキングと Journey 作成で同じ除外判定を使うため
 */
package com.ryvin.matching.scoring;

import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.model.UserProfile;
import java.util.Optional;
import java.util.Set;

/**
 * ある利用者から見た候補の除外規則。
 *
 * <p>除外対象: 本人、進行中 Journey の相手、相互の希望条件 (年齢/距離/性別) を満たさない相手、
 * クールダウン期間内に辞退が発生した相手、未認証の相手。スコア算出後は足切りと致命的な不一致を判定する。
 */
public record EligibilityFilter(
    UserProfile seeker,
    Set<String> activeJourneyPartners,
    Set<String> recentlyDeclinedPartners,
    boolean requireVerified,
    double minimumScore) {

  public EligibilityFilter {
    activeJourneyPartners =
        activeJourneyPartners == null ? Set.of() : Set.copyOf(activeJourneyPartners);
    recentlyDeclinedPartners =
        recentlyDeclinedPartners == null ? Set.of() : Set.copyOf(recentlyDeclinedPartners);
  }

  /** スコア計算前に判定できる規則。 */
  public Optional<ExclusionReason> checkCandidate(UserProfile candidate) {
    if (activeJourneyPartners.contains(candidate.userId())) {
      return Optional.of(ExclusionReason.ACTIVE_JOURNEY);
    }
    return checkPairing(candidate);
  }

  /**
   * 進行中 Journey の有無を除いた規則。Journey 作成時は重複を AlreadyExists として別に扱うため、
   * こちらを使う。
   */
  public Optional<ExclusionReason> checkPairing(UserProfile candidate) {
    if (candidate.userId().equals(seeker.userId())) {
      return Optional.of(ExclusionReason.SELF);
    }
    if (requireVerified && !(isVerified(seeker) && isVerified(candidate))) {
      return Optional.of(ExclusionReason.NOT_VERIFIED);
    }
    if (recentlyDeclinedPartners.contains(candidate.userId())) {
      return Optional.of(ExclusionReason.RECENTLY_DECLINED);
    }
    if (!PreferenceMatcher.mutuallyCompatible(seeker, candidate)) {
      return Optional.of(ExclusionReason.PREFERENCE_MISMATCH);
    }
    return Optional.empty();
  }

  /** ランキング用のスコア判定。足切りを含む。 */
  public Optional<ExclusionReason> checkScore(CompatibilityScore score) {
    if (score.dealBreakerFailed()) {
      return Optional.of(ExclusionReason.DEAL_BREAKER);
    }
    if (score.overall() < minimumScore) {
      return Optional.of(ExclusionReason.BELOW_MINIMUM_SCORE);
    }
    return Optional.empty();
  }

  private static boolean isVerified(UserProfile profile) {
    return profile.verified() && profile.active();
  }
}
