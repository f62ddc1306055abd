package com.example.datalake.sentiment.validation;

import com.example.datalake.sentiment.model.EngineLimits;
import org.springframework.stereotype.Component;

/** Input must hold between one and {@link EngineLimits#MAX_INPUT_TOKENS} tokens. */
@Component
public class TokenCountValidator implements Validator {

  private final int maxTokens;

  public TokenCountValidator() {
    this(EngineLimits.MAX_INPUT_TOKENS);
  }

  public TokenCountValidator(int maxTokens) {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
    this.maxTokens = maxTokens;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.INPUT;
  }

  @Override
  public void validate(ValidationContext context) {
    int count = context.getTokenIds().size();
    if (count == 0) {
      throw new ValidationException("Input must contain at least one token.");
    }
    if (count > maxTokens) {
      throw new ValidationException(
          String.format("Input must not exceed %d tokens (got %d).", maxTokens, count));
    }
  }
}
