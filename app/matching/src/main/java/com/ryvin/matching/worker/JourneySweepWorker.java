/*
 * どこで: Matching 期限スイープ
 * 何を: 期限切れの Journey を定期的に拾い、ステージごとのシステム遷移を適用する
 * なぜ: 応答待ちや会議待ちでリクエストを塞がずに期限切れを反映するため
 */
package com.ryvin.matching.worker;

import com.ryvin.matching.config.JourneySweepProperties;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.repository.JourneyRepository;
import com.ryvin.matching.service.JourneyMetrics;
import com.ryvin.matching.service.JourneyService;
import com.ryvin.matching.service.SweepOutcome;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "matching.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class JourneySweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(JourneySweepWorker.class);

  private final JourneyRepository journeyRepository;
  private final JourneyService journeyService;
  private final JourneySweepProperties properties;
  private final JourneyMetrics metrics;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${matching.sweep.poll-interval}")
  public void run() {
    sweepOnce();
  }

  /** 1 バッチ分を処理し、遷移した件数を返す。1 件の失敗で残りを止めない。 */
  public int sweepOnce() {
    final List<JourneyRecord> overdue =
        journeyRepository.findOverdue(Instant.now(clock), properties.batchSize());
    int transitioned = 0;
    for (JourneyRecord journey : overdue) {
      try {
        final SweepOutcome outcome = journeyService.applyDeadline(journey);
        metrics.recordSweepResult(outcome.value());
        if (outcome == SweepOutcome.TRANSITIONED) {
          transitioned++;
        }
      } catch (RuntimeException ex) {
        metrics.recordSweepResult("error");
        logger.warn(
            "journey sweep failed journeyId={} stage={}", journey.journeyId(), journey.stage(), ex);
      }
    }
    if (!overdue.isEmpty()) {
      logger.info(
          "journey sweep finished scanned={} transitioned={}", overdue.size(), transitioned);
    }
    return transitioned;
  }
}
