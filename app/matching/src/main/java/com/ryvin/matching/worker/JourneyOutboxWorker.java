/*
 * どこで: Matching 通知 outbox ワーカー
 * 何を: 未送信の遷移通知の publish と送信済み行の削除をスケジュールで起動する
 * なぜ: 送信をリクエストスレッドから外し、固定遅延で直前の処理の完了を待って回すため
 */
package com.ryvin.matching.worker;

import com.ryvin.matching.service.JourneyOutboxPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "matching.outbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class JourneyOutboxWorker {

  private final JourneyOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${matching.outbox.poll-interval}")
  public void run() {
    publisher.publishPendingBatch();
  }

  @Scheduled(fixedDelayString = "${matching.outbox.retention-interval}")
  public void purge() {
    publisher.purgePublished();
  }
}
