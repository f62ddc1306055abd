package com.example.datalake.sentiment.validation;

import org.springframework.stereotype.Component;

@Component
public class VocabularyInitializedValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.VOCABULARY;
  }

  @Override
  public void validate(ValidationContext context) {
    if (context.getVocabularySize() == 0) {
      throw new ValidationException("Vocabulary has not been initialized.");
    }
  }
}
