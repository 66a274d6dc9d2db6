package com.ryvin.matching.model;

/**
 * 状態変更コマンドの成功種別。
 *
 * <p>ALREADY_APPLIED は、競合した別の遷移によって呼び出し側の意図が既に達成済みだったことを示す。
 */
public enum CommandOutcome {
  APPLIED,
  ALREADY_APPLIED
}
