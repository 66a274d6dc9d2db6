/*
 * どこで: Matching 設定
 * 何を: Journey のステージ期限と再試行上限を保持する
 * なぜ: 期限や上限を環境ごとに変え、テストで短く上書きできるようにするため
 */
package com.ryvin.matching.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matching.journey")
public record JourneyProperties(
    @NotNull Duration proposalTimeout,
    @NotNull Duration conversationTimeout,
    @NotNull Duration meetingResponseTimeout,
    @NotNull Duration meetingCompletionGrace,
    @NotNull Duration feedbackWindow,
    @Min(0) int maxMeetingRetries,
    @NotNull Duration declineCooldown,
    @Min(1) int casMaxAttempts) {}
