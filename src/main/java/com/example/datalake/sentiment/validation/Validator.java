package com.example.datalake.sentiment.validation;

/** One classification input check. Implementations throw {@link ValidationException}. */
public interface Validator {

  ValidationStage stage();

  void validate(ValidationContext context);
}
