package com.example.datalake.sentiment.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.sentiment.access.EngineSuspendedException;
import com.example.datalake.sentiment.access.PermissionDeniedException;
import com.example.datalake.sentiment.response.ErrorResponse;
import com.example.datalake.sentiment.validation.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class EngineExceptionHandlerTest {

  private final EngineExceptionHandler handler = new EngineExceptionHandler();

  @Test
  void validationFailuresAreBadRequests() {
    ResponseEntity<ErrorResponse> response = handler.handleValidation(
        new ValidationException(List.of("words must be provided.", "weights must be provided.")));

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody()).isEqualTo(new ErrorResponse(
        "validation_failed", List.of("words must be provided.", "weights must be provided.")));
  }

  @Test
  void missingRoleIsForbidden() {
    ResponseEntity<ErrorResponse> response = handler.handlePermission(
        new PermissionDeniedException("mallory", "trainer"));

    assertThat(response.getStatusCode().value()).isEqualTo(403);
    assertThat(response.getBody().error()).isEqualTo("permission_denied");
    assertThat(response.getBody().details()).containsExactly("Caller 'mallory' does not hold the trainer role.");
  }

  @Test
  void pausedEngineIsUnavailable() {
    ResponseEntity<ErrorResponse> response = handler.handleSuspended(new EngineSuspendedException());

    assertThat(response.getStatusCode().value()).isEqualTo(503);
    assertThat(response.getBody().error()).isEqualTo("engine_paused");
  }
}
