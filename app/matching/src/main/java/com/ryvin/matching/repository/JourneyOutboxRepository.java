package com.ryvin.matching.repository;

import com.ryvin.matching.model.OutboxEventRecord;
import com.ryvin.matching.model.OutboxStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 遷移通知の outbox。insert は遷移と同じトランザクションで呼ばれ、それ以外は publish ワーカーから呼ばれる。
 *
 * <p>markPublished / markFailure は claim したワーカー自身の行だけを更新し、更新件数を返す。
 */
public interface JourneyOutboxRepository {

  int insert(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt);

  /** 送信可能な PENDING とリース切れの IN_FLIGHT を作成順に最大 limit 件 claim する。 */
  List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy);

  int markPublished(UUID eventId, String lockedBy, Instant publishedAt);

  int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError);

  int deletePublishedOlderThan(Instant threshold);

  int countFailed();
}
