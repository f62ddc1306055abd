package com.example.datalake.sentiment.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.example.datalake.sentiment.support.EngineTestSupport;
import java.util.List;
import org.junit.jupiter.api.Test;

class OverwriteValidatorTest {

  private final OverwriteValidator validator = new OverwriteValidator();

  @Test
  void acceptsEmbeddingWithinBounds() {
    List<Integer> semantic = EngineTestSupport.list(EngineTestSupport.unit(24, 0, 1_000_000));
    List<Integer> context = EngineTestSupport.list(EngineTestSupport.unit(8, 7, -1_000_000));

    assertThatCode(() -> validator.validateTokenEmbedding(1023, semantic, context))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsEmbeddingWithWrongShapeOrMagnitude() {
    List<Integer> semantic = EngineTestSupport.list(EngineTestSupport.unit(24, 2, 1_000_001));
    List<Integer> context = List.of(1, 2, 3);

    ValidationException ex = catchThrowableOfType(
        () -> validator.validateTokenEmbedding(1024, semantic, context), ValidationException.class);

    assertThat(ex.getReasons()).containsExactly(
        "Token id 1024 is outside [0, 1024).",
        "semantic[2]=1000001 is outside [-1000000, 1000000].",
        "context must have exactly 8 entries.");
  }

  @Test
  void rejectsUnknownClass() {
    ValidationException ex = catchThrowableOfType(
        () -> validator.validateClassWeights(7, EngineTestSupport.list(new int[24]),
            EngineTestSupport.list(new int[8])),
        ValidationException.class);

    assertThat(ex.getReasons()).containsExactly("Class id 7 is outside [0, 7).");
  }

  @Test
  void checksDomainModifierBounds() {
    assertThatCode(() -> validator.validateDomainModifier(9, List.of(-1000, 0, 0, 0, 0, 0, 1000), 100))
        .doesNotThrowAnyException();

    ValidationException ex = catchThrowableOfType(
        () -> validator.validateDomainModifier(10, List.of(0, 1001), 101), ValidationException.class);

    assertThat(ex.getReasons()).containsExactly(
        "Domain id 10 is outside [0, 10).",
        "bias must have exactly 7 entries.",
        "intensity=101 is outside [0, 100].");
  }
}
