/*
 * どこで: Matching API レスポンス DTO
 * 何を: Journey の現在状態を返す
 * なぜ: ステージ/期限/同意状況をクライアントが表示できるようにするため
 */
package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.JourneyRecord;
import com.ryvin.matching.model.JourneyStage;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record JourneyResponse(
    String journeyId,
    List<String> participants,
    String initiator,
    String stage,
    boolean terminal,
    long version,
    Map<String, List<String>> consent,
    String deadline,
    int failedMeetingAttempts,
    String endedBy,
    String endReason,
    String createdAt,
    String updatedAt) {

  public static JourneyResponse from(JourneyRecord journey) {
    final Map<String, List<String>> consent = new TreeMap<>();
    for (Map.Entry<JourneyStage, Set<String>> grant : journey.consent().grants().entrySet()) {
      consent.put(grant.getKey().name(), List.copyOf(grant.getValue()));
    }
    return new JourneyResponse(
        journey.journeyId(),
        journey.participants(),
        journey.initiator(),
        journey.stage().name(),
        journey.stage().terminal(),
        journey.version(),
        consent,
        ResponseTimes.iso(journey.deadline()),
        journey.failedMeetingAttempts(),
        journey.endedBy(),
        journey.endReason(),
        ResponseTimes.iso(journey.createdAt()),
        ResponseTimes.iso(journey.updatedAt()));
  }
}
