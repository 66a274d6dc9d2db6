package com.ryvin.matching.model;

import java.util.UUID;

/** claim 済みの outbox 行。payloadJson は JourneyEventPayload の JSON 表現。 */
public record OutboxEventRecord(
    UUID eventId, String eventType, String aggregateKey, String payloadJson, int attemptCount) {}
