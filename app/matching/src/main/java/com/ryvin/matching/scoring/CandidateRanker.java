/*
 * どこで: Matching スコアリング
 * 何を: 候補プールを除外規則で絞り込み、互換性スコア順に並べる
 * なぜ: 同じ入力なら同点時も含めて常に同じ順序を返すため
 */
package com.ryvin.matching.scoring;

import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.model.UserProfile;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import org.springframework.stereotype.Component;

@Component
public class CandidateRanker {

  // overall 降順 -> 共通回答数 降順 -> 候補 id 昇順
  static final Comparator<RankedCandidate> ORDER =
      Comparator.comparingDouble((RankedCandidate candidate) -> candidate.score().overall())
          .reversed()
          .thenComparing(
              Comparator.comparingInt(
                      (RankedCandidate candidate) -> candidate.score().mutualFieldCount())
                  .reversed())
          .thenComparing(RankedCandidate::candidateId);

  /**
   * 役割: 候補プールを順位付けする。
   * 動作: 走査されるまで採点しない。結果は一度だけ計算して以降は使い回す。副作用は持たない。
   * 前提: scoreAgainst は候補 id から利用者とのスコアを返す純粋関数であること。
   */
  public RankedCandidates rank(
      EligibilityFilter filter,
      Collection<UserProfile> pool,
      Function<String, CompatibilityScore> scoreAgainst) {
    final List<UserProfile> snapshot = List.copyOf(pool);
    return new RankedCandidates(() -> evaluate(filter, snapshot, scoreAgainst));
  }

  private List<RankedCandidate> evaluate(
      EligibilityFilter filter,
      List<UserProfile> pool,
      Function<String, CompatibilityScore> scoreAgainst) {
    // 重複した候補は id で 1 件にまとめる
    final Map<String, UserProfile> unique = new TreeMap<>();
    for (UserProfile profile : pool) {
      unique.putIfAbsent(profile.userId(), profile);
    }
    final List<RankedCandidate> ranked = new ArrayList<>();
    for (UserProfile candidate : unique.values()) {
      if (filter.checkCandidate(candidate).isPresent()) {
        continue;
      }
      final CompatibilityScore score = scoreAgainst.apply(candidate.userId());
      if (filter.checkScore(score).isPresent()) {
        continue;
      }
      ranked.add(new RankedCandidate(candidate.userId(), score));
    }
    ranked.sort(ORDER);
    return ranked;
  }
}
