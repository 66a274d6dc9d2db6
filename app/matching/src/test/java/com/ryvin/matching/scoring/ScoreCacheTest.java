package com.ryvin.matching.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.service.MatchingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScoreCacheTest {

  private static final ScoreCacheKey KEY = ScoreCacheKey.of("bob", "alice", 1L);

  private ScoreCache cache;

  @BeforeEach
  void setUp() {
    cache =
        new ScoreCache(
            Caffeine.newBuilder().<ScoreCacheKey, CompatibilityScore>build(),
            new MatchingMetrics(new SimpleMeterRegistry()));
  }

  @Test
  void storesComputedScoreWhenNoInvalidationHappened() {
    cache.get(KEY, () -> score(0.8));

    assertThat(cache.get(KEY, () -> score(0.1)).overall()).isEqualTo(0.8);
  }

  @Test
  void invalidationDuringLoadKeepsResultOutOfCache() {
    final ScoreCache.Stamp before = cache.stamp(KEY);

    final CompatibilityScore loaded =
        cache.get(
            KEY,
            before,
            () -> {
              cache.invalidateUser("alice");
              return score(0.6);
            });

    assertThat(loaded.overall()).isEqualTo(0.6);
    assertThat(cache.size()).isZero();
    assertThat(cache.get(KEY, () -> score(1.0)).overall()).isEqualTo(1.0);
  }

  @Test
  void invalidatingAnotherUserDoesNotBlockStore() {
    final ScoreCache.Stamp before = cache.stamp(KEY);
    cache.invalidateUser("carol");

    cache.get(KEY, before, () -> score(0.7));

    assertThat(cache.size()).isEqualTo(1L);
  }

  @Test
  void invalidateUserRemovesEveryPairContainingTheUser() {
    cache.get(KEY, () -> score(0.8));
    cache.get(ScoreCacheKey.of("alice", "carol", 1L), () -> score(0.5));
    cache.get(ScoreCacheKey.of("bob", "carol", 1L), () -> score(0.4));

    cache.invalidateUser("alice");

    assertThat(cache.size()).isEqualTo(1L);
    assertThat(cache.stamp(KEY)).isNotEqualTo(new ScoreCache.Stamp(0L, 0L));
  }

  private static CompatibilityScore score(double overall) {
    return new CompatibilityScore(overall, false, List.of(), 1, 1.0, false, List.of(), 1L);
  }
}
