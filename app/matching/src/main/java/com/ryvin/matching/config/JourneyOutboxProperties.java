/*
 * どこで: Matching アプリの設定バインド
 * 何を: 遷移通知 outbox の publish ポーリング/リトライ/保持期間を保持する
 * なぜ: 送信先の障害時の再送間隔を運用側で調整できるようにするため
 */
package com.ryvin.matching.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "matching.outbox")
public record JourneyOutboxProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration lease,
    Duration publishedTtl,
    Duration retentionInterval) {}
