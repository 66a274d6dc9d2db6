package com.ryvin.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.model.CompatibilityScore;
import com.ryvin.matching.model.UserResponses;
import com.ryvin.matching.scoring.ScoreCache;
import com.ryvin.matching.scoring.ScoreCacheKey;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QuestionnaireServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private InMemoryQuestionnaireRepository questionnaireRepository;
  private InMemoryResponseRepository responseRepository;
  private ScoreCache scoreCache;
  private QuestionnaireService service;

  @BeforeEach
  void setUp() {
    questionnaireRepository = new InMemoryQuestionnaireRepository();
    questionnaireRepository.seed(CatalogFixtures.scale("energy", true));
    questionnaireRepository.seed(CatalogFixtures.scale("tidy", false));
    questionnaireRepository.seed(CatalogFixtures.dealBreaker("smoking"));
    questionnaireRepository.seed(
        CatalogFixtures.scale("old_question", false).retire(CatalogFixtures.CREATED_AT));
    responseRepository = new InMemoryResponseRepository();
    scoreCache =
        new ScoreCache(
            Caffeine.newBuilder().<ScoreCacheKey, CompatibilityScore>build(),
            new MatchingMetrics(new SimpleMeterRegistry()));
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    service =
        new QuestionnaireService(
            new CatalogService(questionnaireRepository, scoreCache, clock),
            responseRepository,
            scoreCache,
            clock);
  }

  @Test
  void submitAnswersNormalizesAndOverwrites() {
    service.submitAnswers("alice", Map.of("energy", "4.50", "smoking", "FALSE"));
    final UserResponses responses = service.submitAnswers("alice", Map.of("energy", "7"));

    assertThat(responses.answers())
        .containsOnly(Map.entry("energy", "7"), Map.entry("smoking", "false"));
  }

  @Test
  void submitAnswersWritesNothingWhenOneAnswerIsInvalid() {
    assertThatThrownBy(
            () -> service.submitAnswers("alice", Map.of("energy", "5", "tidy", "11")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("out of range");

    assertThat(service.getAnswers("alice").answers()).isEmpty();
  }

  @Test
  void submitAnswersRejectsRetiredAndUnknownFields() {
    assertThatThrownBy(() -> service.submitAnswers("alice", Map.of("old_question", "3")))
        .isInstanceOf(ValidationException.class)
        .hasMessage("field is retired: old_question");
    assertThatThrownBy(() -> service.submitAnswers("alice", Map.of("nope", "3")))
        .isInstanceOf(ValidationException.class)
        .hasMessage("unknown field: nope");
  }

  @Test
  void submitAnswersDropsCachedScoresOfThatUserOnly() {
    scoreCache.get(ScoreCacheKey.of("alice", "bob", 1), QuestionnaireServiceTest::anyScore);
    scoreCache.get(ScoreCacheKey.of("carol", "bob", 1), QuestionnaireServiceTest::anyScore);

    service.submitAnswers("alice", Map.of("energy", "3"));

    assertThat(scoreCache.size()).isEqualTo(1L);
  }

  @Test
  void missingRequiredFieldsListsUnansweredInIdOrder() {
    assertThat(service.missingRequiredFields("alice")).containsExactly("energy", "smoking");

    service.submitAnswers("alice", Map.of("smoking", "true"));

    assertThat(service.missingRequiredFields("alice")).containsExactly("energy");
  }

  @Test
  void emptySubmissionIsRejected() {
    assertThatThrownBy(() -> service.submitAnswers("alice", Map.of()))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.getAnswers(" ")).isInstanceOf(ValidationException.class);
  }

  private static CompatibilityScore anyScore() {
    return new CompatibilityScore(0.5, false, List.of(), 1, 1.0, false, List.of(), 1);
  }
}
