/*
 * どこで: Matching 設定
 * 何を: 候補ランキングの足切り/件数とスコアキャッシュの設定を保持する
 * なぜ: 運用中に候補の質と量を調整できるようにするため
 */
package com.ryvin.matching.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "matching.scoring")
public record MatchingScoringProperties(
    Double minimumScore,
    Integer defaultCandidateLimit,
    Integer maxCandidateLimit,
    Integer candidatePoolSize,
    Boolean requireVerified,
    Long scoreCacheMaximumSize,
    Duration scoreCacheTtl) {

  public MatchingScoringProperties {
    minimumScore = minimumScore == null ? 0.5 : minimumScore;
    defaultCandidateLimit = defaultCandidateLimit == null ? 20 : defaultCandidateLimit;
    maxCandidateLimit = maxCandidateLimit == null ? 100 : maxCandidateLimit;
    candidatePoolSize = candidatePoolSize == null ? 100 : candidatePoolSize;
    requireVerified = requireVerified == null ? Boolean.TRUE : requireVerified;
    scoreCacheMaximumSize = scoreCacheMaximumSize == null ? 100_000L : scoreCacheMaximumSize;
    scoreCacheTtl = scoreCacheTtl == null ? Duration.ofMinutes(30) : scoreCacheTtl;
  }
}
