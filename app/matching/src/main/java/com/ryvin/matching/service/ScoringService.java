package com.ryvin.matching.service;

import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.model.QuestionnaireCatalog;
import com.ryvin.matching.model.UserResponses;
import com.ryvin.matching.repository.ResponseRepository;
import com.ryvin.matching.scoring.CompatibilityScorer;
import com.ryvin.matching.scoring.ScoreCache;
import com.ryvin.matching.scoring.ScoreCacheKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScoringService {

  private final CatalogService catalogService;
  private final ResponseRepository responseRepository;
  private final CompatibilityScorer scorer;
  private final ScoreCache scoreCache;
  private final MatchingMetrics metrics;

  public CompatibilityScore score(String userA, String userB) {
    if (userA == null || userA.isBlank() || userB == null || userB.isBlank()) {
      throw new ValidationException("user_a and user_b are required");
    }
    if (userA.equals(userB)) {
      throw new ValidationException("user_a and user_b must differ");
    }
    final QuestionnaireCatalog catalog = catalogService.currentCatalog();
    return scoreCache.get(
        ScoreCacheKey.of(userA, userB, catalog.version()),
        () -> {
          final Map<String, UserResponses> responses =
              responseRepository.findByUserIds(List.of(userA, userB));
          return timed(responses.get(userA), responses.get(userB), catalog);
        });
  }

  /**
   * 役割: 1 人の利用者と複数候補のスコア関数を作る。
   * 動作: 回答は 1 回の問い合わせでまとめて読み、各スコアはキャッシュを経由して計算する。
   * 前提: 返す関数は candidateIds に含まれる id だけで呼ぶこと。
   */
  public Function<String, CompatibilityScore> scorerFor(
      String userId, Collection<String> candidateIds) {
    final QuestionnaireCatalog catalog = catalogService.currentCatalog();
    // 破棄世代は回答を読む前に取る
    final Map<String, ScoreCache.Stamp> stamps = new HashMap<>();
    for (String candidateId : candidateIds) {
      stamps.put(
          candidateId,
          scoreCache.stamp(ScoreCacheKey.of(userId, candidateId, catalog.version())));
    }
    final List<String> userIds = new ArrayList<>(candidateIds);
    userIds.add(userId);
    final Map<String, UserResponses> responses = responseRepository.findByUserIds(userIds);
    final UserResponses seeker = responses.get(userId);
    return candidateId -> {
      final ScoreCache.Stamp stamp = stamps.get(candidateId);
      if (stamp == null) {
        throw new IllegalArgumentException("candidate was not loaded: " + candidateId);
      }
      return scoreCache.get(
          ScoreCacheKey.of(userId, candidateId, catalog.version()),
          stamp,
          () ->
              timed(
                  seeker,
                  responses.getOrDefault(candidateId, UserResponses.empty(candidateId)),
                  catalog));
    };
  }

  private CompatibilityScore timed(
      UserResponses userA, UserResponses userB, QuestionnaireCatalog catalog) {
    final long started = System.nanoTime();
    final CompatibilityScore score = scorer.score(userA, userB, catalog);
    metrics.recordScoreDuration(Duration.ofNanos(System.nanoTime() - started));
    return score;
  }
}
