package com.ryvin.matching.api;

import com.ryvin.matching.model.ConsentLedger;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.model.MeetingRequestRecord;
import com.ryvin.matching.model.MeetingStatus;
import java.time.Duration;
import java.time.Instant;

final class ApiFixtures {

  static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  private ApiFixtures() {}

  static JourneyRecord journey(JourneyStage stage, long version) {
    return new JourneyRecord(
        "journey-1",
        "alice",
        "bob",
        "alice",
        stage,
        version,
        ConsentLedger.empty().grant(JourneyStage.PROPOSED, "alice"),
        stage.terminal() ? null : NOW.plus(Duration.ofHours(72)),
        0,
        null,
        null,
        NOW,
        NOW);
  }

  static MeetingRequestRecord meeting(MeetingStatus status) {
    return new MeetingRequestRecord(
        "meeting-1",
        "journey-1",
        "alice",
        Instant.parse("2026-03-05T18:00:00Z"),
        "Shibuya",
        status,
        NOW.plus(Duration.ofHours(48)),
        null,
        null,
        null,
        NOW);
  }
}
