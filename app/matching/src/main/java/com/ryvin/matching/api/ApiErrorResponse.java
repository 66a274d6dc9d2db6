/*
 * どこで: Matching API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因と参照先 (既存 Journey など) を識別しやすくするため
 */
package com.ryvin.matching.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message, String reference) {

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null);
  }
}
