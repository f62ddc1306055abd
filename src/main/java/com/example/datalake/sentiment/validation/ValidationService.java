package com.example.datalake.sentiment.validation;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the registered {@link Validator}s against a classification request, INPUT stage first,
 * TOKENS last. A failing validator aborts the call with its reasons.
 */
@Slf4j
@Service
public class ValidationService {

  private final List<Validator> pipeline;

  public ValidationService(List<Validator> validators) {
    this.pipeline = validators == null
        ? List.of()
        : validators.stream()
            .filter(v -> v != null)
            .sorted(Comparator.comparing(Validator::stage))
            .toList();
    log.debug("[validation] pipeline: {}", pipeline.stream()
        .map(v -> v.stage() + ":" + v.getClass().getSimpleName())
        .collect(Collectors.joining(", ")));
  }

  /** Checks {@code tokenIds} against a vocabulary of {@code vocabularySize} tokens. */
  public ValidationContext validate(List<Integer> tokenIds, int vocabularySize) {
    ValidationContext request = new ValidationContext(tokenIds, vocabularySize);
    pipeline.forEach(validator -> validator.validate(request));
    return request;
  }
}
