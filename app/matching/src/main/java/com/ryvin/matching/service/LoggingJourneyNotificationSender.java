package com.ryvin.matching.service;

import com.ryvin.common.event.JourneyEventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** NATS を使わない環境向け。遷移をログに残すだけで外部へは送らない。 */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingJourneyNotificationSender implements JourneyNotificationSender {

  private static final Logger logger =
      LoggerFactory.getLogger(LoggingJourneyNotificationSender.class);

  @Override
  public void send(JourneyEventPayload payload) {
    logger.info(
        "journey transition journeyId={} from={} to={} trigger={} eventId={}",
        payload.journeyId(),
        payload.fromStage(),
        payload.toStage(),
        payload.trigger(),
        payload.eventId());
  }
}
