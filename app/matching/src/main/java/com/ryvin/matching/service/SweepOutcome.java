package com.ryvin.matching.service;

import java.util.Locale;

/** 期限スイープで 1 件の Journey を処理した結果。 */
public enum SweepOutcome {
  TRANSITIONED,
  // 既に同じ終端に到達していた
  ALREADY_APPLIED,
  // 読み込み後に期限が延びた、または遷移できないステージだった
  SKIPPED,
  // 利用者操作との比較交換に負けた。次回のスイープで再評価する
  CONFLICT;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
