package com.ryvin.matching.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ryvin.matching.api.ValidationException;
import com.ryvin.matching.model.QuestionnaireField;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnswerNormalizerTest {

  @Test
  void normalizesScaleNumbers() {
    assertThat(AnswerNormalizer.normalize(CompatibilityScorerTest.scale("e", "c", 1), " 4.50 "))
        .isEqualTo("4.5");
    assertThat(AnswerNormalizer.normalize(CompatibilityScorerTest.scale("e", "c", 1), "10"))
        .isEqualTo("10");
  }

  @Test
  void rejectsScaleOutsideRange() {
    assertThatThrownBy(
            () -> AnswerNormalizer.normalize(CompatibilityScorerTest.scale("e", "c", 1), "11"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("out of range");
    assertThatThrownBy(
            () -> AnswerNormalizer.normalize(CompatibilityScorerTest.scale("e", "c", 1), "ten"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void normalizesBooleanCase() {
    assertThat(
            AnswerNormalizer.normalize(CompatibilityScorerTest.bool("b", "c", 1, false), "TRUE"))
        .isEqualTo("true");
    assertThatThrownBy(
            () ->
                AnswerNormalizer.normalize(
                    CompatibilityScorerTest.bool("b", "c", 1, false), "yes"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void choiceMustBeADeclaredOption() {
    final QuestionnaireField diet = CompatibilityScorerTest.choice("diet", "c", 1, Map.of());

    assertThat(AnswerNormalizer.normalize(diet, "vegan")).isEqualTo("vegan");
    assertThatThrownBy(() -> AnswerNormalizer.normalize(diet, "carnivore"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> AnswerNormalizer.normalize(diet, " "))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("answer is required");
  }
}
