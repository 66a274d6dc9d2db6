/*
 * どこで: Matching スコアリング
 * 何を: 計算済みの互換性スコアをプロセス内に保持する
 * なぜ: ランキング時の再計算を避けつつ、回答/カタログ変更時に確実に破棄するため
 */
package com.ryvin.matching.scoring;

import com.github.benmanes.caffeine.cache.Cache;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.service.MatchingMetrics;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScoreCache {

  private final Cache<ScoreCacheKey, CompatibilityScore> scoreCacheStore;
  private final MatchingMetrics metrics;
  // 回答を更新したユーザーごとの破棄回数。読み込み開始時の値と比べ、古い回答からの結果を格納しない
  private final ConcurrentMap<String, Long> generations = new ConcurrentHashMap<>();

  /** 読み込み開始時の世代を取って計算する。 */
  public CompatibilityScore get(ScoreCacheKey key, Supplier<CompatibilityScore> loader) {
    return get(key, stamp(key), loader);
  }

  /**
   * 役割: キャッシュを引き、無ければ計算して格納する。
   * 動作: 計算中にどちらかのユーザーが破棄されていれば、結果は返すが格納はしない。
   * 前提: stamp は loader が使う回答を読む前に {@link #stamp} で取ったものであること。
   */
  public CompatibilityScore get(
      ScoreCacheKey key, Stamp stamp, Supplier<CompatibilityScore> loader) {
    final CompatibilityScore cached = scoreCacheStore.getIfPresent(key);
    if (cached != null) {
      metrics.recordScoreCache("hit");
      return cached;
    }
    metrics.recordScoreCache("miss");
    final CompatibilityScore computed = loader.get();
    scoreCacheStore
        .asMap()
        .compute(key, (ignored, existing) -> stamp.equals(stamp(key)) ? computed : existing);
    return computed;
  }

  public Stamp stamp(ScoreCacheKey key) {
    return new Stamp(generation(key.userLow()), generation(key.userHigh()));
  }

  /** 回答が変わったユーザーを含むエントリを全て破棄する。世代を先に進めてから消す。 */
  public void invalidateUser(String userId) {
    generations.merge(userId, 1L, Long::sum);
    scoreCacheStore.asMap().keySet().removeIf(key -> key.involves(userId));
  }

  public void invalidateAll() {
    scoreCacheStore.invalidateAll();
  }

  public long size() {
    return scoreCacheStore.estimatedSize();
  }

  private long generation(String userId) {
    return generations.getOrDefault(userId, 0L);
  }

  /** ユーザー対の破棄世代。 */
  public record Stamp(long lowGeneration, long highGeneration) {}
}
