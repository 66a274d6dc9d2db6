package com.ryvin.matching.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ryvin.matching.model.FeedbackRecord;
import com.ryvin.matching.model.FeedbackSummary;
import com.ryvin.matching.service.FeedbackService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(FeedbackController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class FeedbackControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private FeedbackService feedbackService;

  @Test
  void listDefaultsToSubmitted() throws Exception {
    when(feedbackService.listFeedback("alice", FeedbackService.Direction.SUBMITTED, "alice"))
        .thenReturn(
            List.of(
                new FeedbackRecord(
                    "feedback-1",
                    "meeting-1",
                    "journey-1",
                    "alice",
                    "bob",
                    5,
                    null,
                    true,
                    ApiFixtures.NOW)));

    mockMvc
        .perform(get("/v1/users/alice/feedback").header("X-User-Id", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.direction").value("submitted"))
        .andExpect(jsonPath("$.feedback[0].rating").value(5));
  }

  @Test
  void listRejectsUnknownDirection() throws Exception {
    mockMvc
        .perform(
            get("/v1/users/alice/feedback")
                .param("direction", "sideways")
                .header("X-User-Id", "alice"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("unknown direction: sideways"));
  }

  @Test
  void summaryOfOtherUserIsForbidden() throws Exception {
    when(feedbackService.summarize(eq("bob"), any()))
        .thenThrow(new MatchingAccessDeniedException("users can only read their own feedback"));

    mockMvc
        .perform(get("/v1/users/bob/feedback/summary").header("X-User-Id", "alice"))
        .andExpect(status().isForbidden());
  }

  @Test
  void summaryReturnsAggregates() throws Exception {
    when(feedbackService.summarize("alice", "alice"))
        .thenReturn(new FeedbackSummary("alice", 2, 4.5, 0.5));

    mockMvc
        .perform(get("/v1/users/alice/feedback/summary").header("X-User-Id", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(2))
        .andExpect(jsonPath("$.average_rating").value(4.5))
        .andExpect(jsonPath("$.continue_ratio").value(0.5));
  }
}
