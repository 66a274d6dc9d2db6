package com.ryvin.matching.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JourneyStageTest {

  @Test
  void terminalStagesHaveNoOutgoingEdges() {
    for (JourneyStage terminal : JourneyStage.values()) {
      if (!terminal.terminal()) {
        continue;
      }
      for (JourneyStage next : JourneyStage.values()) {
        assertThat(terminal.canTransitionTo(next)).isFalse();
      }
    }
  }

  @Test
  void everyActiveStageCanEndInDeclineOrExpiry() {
    for (JourneyStage stage : JourneyStage.values()) {
      if (stage.terminal()) {
        continue;
      }
      assertThat(stage.canTransitionTo(JourneyStage.DECLINED)).isTrue();
      assertThat(stage.canTransitionTo(JourneyStage.EXPIRED)).isTrue();
    }
  }

  @Test
  void meetingFailureReturnsToConversation() {
    assertThat(JourneyStage.MEETING_PROPOSED.canTransitionTo(JourneyStage.GUIDED_CONVERSATION))
        .isTrue();
    assertThat(JourneyStage.PROPOSED.canTransitionTo(JourneyStage.ONGOING)).isFalse();
    assertThat(JourneyStage.PROPOSED.canTransitionTo(null)).isFalse();
  }

  @Test
  void fromValueIsCaseInsensitive() {
    assertThat(JourneyStage.fromValue("guided_conversation"))
        .isEqualTo(JourneyStage.GUIDED_CONVERSATION);
    assertThatThrownBy(() -> JourneyStage.fromValue("dating"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
