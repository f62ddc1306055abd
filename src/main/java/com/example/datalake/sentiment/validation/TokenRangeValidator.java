package com.example.datalake.sentiment.validation;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Every token id must be known to the vocabulary. Reports all offending positions at once. */
@Component
public class TokenRangeValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.TOKENS;
  }

  @Override
  public void validate(ValidationContext context) {
    List<String> reasons = new ArrayList<>();
    List<Integer> ids = context.getTokenIds();
    for (int i = 0; i < ids.size(); i++) {
      Integer id = ids.get(i);
      if (id == null) {
        reasons.add(String.format("Token at position %d is missing.", i));
      } else if (id < 0 || id >= context.getVocabularySize()) {
        reasons.add(
            String.format(
                "Token id %d at position %d is outside the vocabulary (size %d).",
                id, i, context.getVocabularySize()));
      }
    }
    ValidationException.throwIfAny(reasons);
  }
}
