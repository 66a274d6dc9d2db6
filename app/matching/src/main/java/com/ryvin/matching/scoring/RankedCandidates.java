/*
 * どこで: Matching スコアリング
 * 何を: ランキング結果を遅延評価・再走査可能な列として提供する
 * なぜ: 呼び出し側が必要になるまで採点せず、何度走査しても同じ順序を返すため
 */
package com.ryvin.matching.scoring;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

public final class RankedCandidates implements Iterable<RankedCandidate> {

  private final Supplier<List<RankedCandidate>> source;
  private volatile List<RankedCandidate> resolved;

  RankedCandidates(Supplier<List<RankedCandidate>> source) {
    this.source = source;
  }

  @Override
  public Iterator<RankedCandidate> iterator() {
    return resolve().iterator();
  }

  /** 先頭 {@code maxSize} 件に絞った列。元の列と評価結果を共有する。 */
  public RankedCandidates limit(int maxSize) {
    if (maxSize < 0) {
      throw new IllegalArgumentException("maxSize must not be negative");
    }
    return new RankedCandidates(
        () -> {
          final List<RankedCandidate> all = resolve();
          return all.subList(0, Math.min(maxSize, all.size()));
        });
  }

  public List<RankedCandidate> toList() {
    return resolve();
  }

  private List<RankedCandidate> resolve() {
    List<RankedCandidate> current = resolved;
    if (current == null) {
      synchronized (this) {
        current = resolved;
        if (current == null) {
          current = List.copyOf(source.get());
          resolved = current;
        }
      }
    }
    return current;
  }
}
