package com.github.spud.refill.interfaces.rest;

import com.github.spud.refill.domain.error.ErrorKind;
import com.github.spud.refill.domain.error.RefillWorkflowException;
import com.github.spud.refill.domain.error.StoreUnavailableException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Error bodies are generic: exception messages may carry identifiers and are only logged
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {
    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  public static HttpStatus statusOf(RefillWorkflowException e) {
    if (e instanceof StoreUnavailableException) {
      return HttpStatus.SERVICE_UNAVAILABLE;
    }
    switch (e.getKind()) {
      case INVALID_TRANSITION:
        return HttpStatus.UNPROCESSABLE_ENTITY;
      case STALE_SESSION:
        return HttpStatus.CONFLICT;
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  @ExceptionHandler(RefillWorkflowException.class)
  public ResponseEntity<ErrorResponse> handleWorkflowException(RefillWorkflowException e) {
    log.warn("Request failed: kind={}, {}", e.getKind(), e.getMessage());
    ErrorResponse error = ErrorResponse.builder()
        .code(e.getKind().name())
        .message(e.getKind().getUserMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(statusOf(e)).body(error);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }

    ErrorResponse error = ErrorResponse.builder()
        .code("VALIDATION_ERROR")
        .message("Request validation failed")
        .timestamp(OffsetDateTime.now())
        .details(Map.of("fieldErrors", fieldErrors))
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_INPUT")
        .message("Request body could not be read")
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_ARGUMENT")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    ErrorResponse error = ErrorResponse.builder()
        .code(ErrorKind.INTERNAL.name())
        .message(ErrorKind.INTERNAL.getUserMessage())
        .timestamp(OffsetDateTime.now())
        .details(Map.of("exception", e.getClass().getSimpleName()))
        .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }
}
