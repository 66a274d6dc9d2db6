/*
 * どこで: Matching 通知 outbox の publish
 * 何を: journey_outbox_events を claim して通知送信口へ渡し、結果を行へ書き戻す
 * なぜ: 送信の待ち時間と再送をリクエスト処理やスイープから切り離すため
 */
package com.ryvin.matching.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryvin.common.event.JourneyEventPayload;
import com.ryvin.matching.config.JourneyOutboxProperties;
import com.ryvin.matching.model.OutboxEventRecord;
import com.ryvin.matching.model.OutboxStatus;
import com.ryvin.matching.repository.JourneyOutboxRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "matching.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class JourneyOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(JourneyOutboxPublisher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final JourneyOutboxRepository outboxRepository;
  private final JourneyNotificationSender sender;
  private final JourneyOutboxProperties properties;
  private final JourneyMetrics metrics;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public JourneyOutboxPublisher(
      JourneyOutboxRepository outboxRepository,
      JourneyNotificationSender sender,
      JourneyOutboxProperties properties,
      ObjectMapper objectMapper,
      JourneyMetrics metrics,
      Clock clock) {
    this.outboxRepository = outboxRepository;
    this.sender = sender;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** 1 バッチ分を送信し、PUBLISHED にできた件数を返す。1 件の失敗で残りを止めない。 */
  public int publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final List<OutboxEventRecord> pending =
        outboxRepository.claimPending(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    int published = 0;
    for (OutboxEventRecord record : pending) {
      try {
        final JourneyEventPayload payload = parsePayload(record);
        final Instant occurredAt = parseOccurredAt(payload);
        sender.send(payload);
        final int updated = outboxRepository.markPublished(record.eventId(), lockedBy, now);
        if (updated == 0) {
          logger.warn("outbox publish succeeded but lock was lost eventId={}", record.eventId());
        } else {
          published++;
          metrics.recordOutboxPublishDelay(occurredAt, now);
        }
      } catch (RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailedCurrent(outboxRepository.countFailed());
    return published;
  }

  /** publishedTtl を過ぎた PUBLISHED 行を削除する。 */
  public int purgePublished() {
    final Instant threshold = Instant.now(clock).minus(properties.publishedTtl());
    final int deleted = outboxRepository.deletePublishedOlderThan(threshold);
    if (deleted > 0) {
      logger.info("journey outbox purge deleted={} threshold={}", deleted, threshold);
    }
    return deleted;
  }

  private JourneyEventPayload parsePayload(OutboxEventRecord record) {
    try {
      return objectMapper.readValue(record.payloadJson(), JourneyEventPayload.class);
    } catch (JsonProcessingException ex) {
      // 再送しても直らないため即時 FAILED に寄せる
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private void handleFailure(
      OutboxEventRecord record, RuntimeException ex, Instant now, String lockedBy) {
    metrics.recordNotificationError();
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "outbox retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (nonRetryable) {
      logger.error(
          "outbox payload parse failed and moved to FAILED eventId={}", record.eventId(), ex);
    } else if (failed) {
      logger.warn("outbox publish moved to FAILED eventId={}", record.eventId(), ex);
    } else {
      logger.warn(
          "outbox publish retry scheduled eventId={} attempt={}",
          record.eventId(),
          nextAttempt,
          ex);
    }
  }

  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private static Instant parseOccurredAt(JourneyEventPayload payload) {
    if (payload.occurredAt() == null) {
      throw new OutboxPayloadParseException("outbox payload has no occurred_at", null);
    }
    try {
      return Instant.parse(payload.occurredAt());
    } catch (DateTimeParseException ex) {
      throw new OutboxPayloadParseException("outbox payload has invalid occurred_at", ex);
    }
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
