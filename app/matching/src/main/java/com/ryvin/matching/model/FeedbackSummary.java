package com.ryvin.matching.model;

/** あるユーザーが受け取ったフィードバックの集計。件数 0 の場合 averageRating は 0。 */
public record FeedbackSummary(
    String userId, long count, double averageRating, double continueRatio) {}
