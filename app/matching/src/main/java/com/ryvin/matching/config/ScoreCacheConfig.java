package com.ryvin.matching.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.scoring.ScoreCacheKey;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScoreCacheConfig {

  @Bean(name = "scoreCacheStore")
  public Cache<ScoreCacheKey, CompatibilityScore> scoreCacheStore(
      MatchingScoringProperties properties) {
    return Caffeine.newBuilder()
        .expireAfterWrite(properties.scoreCacheTtl())
        .maximumSize(properties.scoreCacheMaximumSize())
        .build();
  }
}
