/*
 * どこで: Matching API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.ryvin.matching.api;

public enum ApiErrorCode {
  VALIDATION_ERROR,
  NOT_ELIGIBLE,
  STATE_CONFLICT,
  ALREADY_EXISTS,
  DUPLICATE_FEEDBACK,
  INVALID_MEETING_STATE,
  NOT_FOUND,
  FORBIDDEN,
  PROFILE_UNAVAILABLE,
  INTERNAL_ERROR
}
