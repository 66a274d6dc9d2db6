package com.ryvin.matching.scoring;

/** 順序なしのユーザー対と catalog_version によるキャッシュキー。 */
public record ScoreCacheKey(String userLow, String userHigh, long catalogVersion) {

  public static ScoreCacheKey of(String userA, String userB, long catalogVersion) {
    return userA.compareTo(userB) <= 0
        ? new ScoreCacheKey(userA, userB, catalogVersion)
        : new ScoreCacheKey(userB, userA, catalogVersion);
  }

  public boolean involves(String userId) {
    return userLow.equals(userId) || userHigh.equals(userId);
  }
}
