package com.ryvin.matching.model;

import java.time.Instant;

/** stage_history の 1 行。追記のみで書き換えない。 */
public record StageHistoryEntry(
    String journeyId,
    JourneyStage fromStage,
    JourneyStage stage,
    String actor,
    JourneyTrigger trigger,
    Instant occurredAt) {}
