package com.ryvin.matching.model;

/** journey_outbox_events.status の取り得る値。 */
public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  PUBLISHED,
  FAILED
}
