/*
 * どこで: Matching 通知送信
 * 何を: Journey のステージ遷移を JSON で JetStream へ publish する
 * なぜ: event_id を Nats-Msg-Id に載せ、再送時も stream 側で重複排除できるようにするため
 */
package com.ryvin.matching.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryvin.common.event.JourneyEventPayload;
import com.ryvin.matching.config.JourneyNatsProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JetStreamJourneyNotificationSender implements JourneyNotificationSender {

  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final JourneyNatsProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public JetStreamJourneyNotificationSender(
      JetStream jetStream, JourneyNatsProperties properties, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void send(JourneyEventPayload payload) {
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, payload.eventType());
    headers.add(HEADER_AGGREGATE_KEY, payload.journeyId());
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    headers.add(HEADER_TRACE_ID, payload.traceId());
    try {
      // puback を受け取れた場合のみ publish 成功とみなす
      final PublishAck ack = jetStream.publish(properties.subject(), headers, serialize(payload));
      if (ack == null) {
        throw new IllegalStateException("puback is missing");
      }
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("journey event publish failed", ex);
    }
  }

  private byte[] serialize(JourneyEventPayload payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("journey event serialization failed", ex);
    }
  }
}
