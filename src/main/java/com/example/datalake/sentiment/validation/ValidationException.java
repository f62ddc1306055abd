package com.example.datalake.sentiment.validation;

import java.util.List;

/**
 * A request broke an input, vocabulary or training constraint. Always raised before any state is
 * written, so the same engine can take a corrected request right away.
 */
public class ValidationException extends RuntimeException {

  private final List<String> reasons;

  public ValidationException(String reason) {
    this(List.of(reason));
  }

  public ValidationException(List<String> reasons) {
    super(String.join("; ", reasons));
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("a validation failure needs at least one reason");
    }
    this.reasons = List.copyOf(reasons);
  }

  /** Every broken constraint, in the order it was found. */
  public List<String> getReasons() {
    return reasons;
  }

  /** Throws when {@code reasons} is non-empty. */
  public static void throwIfAny(List<String> reasons) {
    if (!reasons.isEmpty()) {
      throw new ValidationException(reasons);
    }
  }
}
