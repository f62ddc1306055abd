package com.example.datalake.sentiment.validation;

/** Order in which classification input checks run. */
public enum ValidationStage {
  /** Shape of the request alone: token count. */
  INPUT,
  /** Whether the engine can classify anything at all. */
  VOCABULARY,
  /** Individual token ids against the current vocabulary. */
  TOKENS
}
