package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.JourneyStage;
import com.ryvin.matching.service.JourneyView;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record JourneyDetailResponse(
    JourneyResponse journey,
    List<StageHistoryResponse> history,
    Map<String, Long> timeInStageSeconds,
    List<MeetingResponse> meetings) {

  public static JourneyDetailResponse from(JourneyView view) {
    // ステージの定義順で並べる
    final Map<String, Long> timeInStage = new LinkedHashMap<>();
    for (JourneyStage stage : JourneyStage.values()) {
      final Duration spent = view.timeInStage().get(stage);
      if (spent != null) {
        timeInStage.put(stage.name(), spent.getSeconds());
      }
    }
    return new JourneyDetailResponse(
        JourneyResponse.from(view.journey()),
        view.history().stream().map(StageHistoryResponse::from).toList(),
        timeInStage,
        view.meetings().stream().map(MeetingResponse::from).toList());
  }
}
