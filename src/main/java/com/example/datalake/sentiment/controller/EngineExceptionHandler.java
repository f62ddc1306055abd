package com.example.datalake.sentiment.controller;

import com.example.datalake.sentiment.access.EngineSuspendedException;
import com.example.datalake.sentiment.access.PermissionDeniedException;
import com.example.datalake.sentiment.response.ErrorResponse;
import com.example.datalake.sentiment.validation.ValidationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps engine failures raised by the synchronous endpoints to HTTP responses. */
@Slf4j
@RestControllerAdvice
public class EngineExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("validation_failed", ex.getReasons()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(new ErrorResponse("validation_failed", details));
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermission(PermissionDeniedException ex) {
        log.warn("Rejected call from {}: {} role required", ex.getCaller(), ex.getRequiredRole());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("permission_denied", List.of(ex.getMessage())));
    }

    @ExceptionHandler(EngineSuspendedException.class)
    public ResponseEntity<ErrorResponse> handleSuspended(EngineSuspendedException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("engine_paused", List.of(ex.getMessage())));
    }
}
