package com.ryvin.matching.scoring;

/** 候補から除外された理由。NotEligible 応答にもそのまま使う。 */
public enum ExclusionReason {
  SELF("self"),
  ACTIVE_JOURNEY("active_journey"),
  NOT_VERIFIED("not_verified"),
  PREFERENCE_MISMATCH("preference_mismatch"),
  RECENTLY_DECLINED("recently_declined"),
  DEAL_BREAKER("deal_breaker"),
  BELOW_MINIMUM_SCORE("below_minimum_score");

  private final String value;

  ExclusionReason(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
