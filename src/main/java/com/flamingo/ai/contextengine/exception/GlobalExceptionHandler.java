package com.flamingo.ai.contextengine.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(PromptTestNotFoundException.class)
  public ResponseEntity<ApiError> handlePromptTestNotFound(
      PromptTestNotFoundException ex, HttpServletRequest request) {

    String errorId = record("prompt_test_not_found");
    log.warn("Prompt test not found [{}]: {}", errorId, ex.getTestId());

    return respond(
        HttpStatus.NOT_FOUND,
        error(errorId, ApiError.PROMPT_TEST_NOT_FOUND, "Prompt test not found", request));
  }

  @ExceptionHandler(InvalidPromptTestException.class)
  public ResponseEntity<ApiError> handleInvalidPromptTest(
      InvalidPromptTestException ex, HttpServletRequest request) {

    String errorId = record("prompt_test_invalid");
    log.warn("Invalid prompt test [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        error(errorId, ApiError.PROMPT_TEST_INVALID, ex.getMessage(), request));
  }

  @ExceptionHandler(ProviderRateLimitedException.class)
  public ResponseEntity<ApiError> handleRateLimited(
      ProviderRateLimitedException ex, HttpServletRequest request) {

    String errorId = record("provider_rate_limited");
    log.warn("Provider rate limited [{}]: {}", errorId, ex.getMessage());

    ApiError.ApiErrorBuilder body =
        errorBuilder(errorId, ApiError.PROVIDER_RATE_LIMITED, ex.getUserMessage(), request);
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
    if (ex.getRetryAfter() != null) {
      long seconds = Math.max(1, ex.getRetryAfter().toSeconds());
      builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
      body.retryAfterSeconds(seconds);
    }
    return builder.body(body.build());
  }

  @ExceptionHandler(ProviderClientException.class)
  public ResponseEntity<ApiError> handleProviderClient(
      ProviderClientException ex, HttpServletRequest request) {

    String errorId = record("provider_client_error");
    log.error(
        "Provider rejected request [{}] with status {}: {}",
        errorId,
        ex.getStatusCode(),
        ex.getMessage());

    return respond(
        HttpStatus.BAD_GATEWAY,
        error(errorId, ApiError.PROVIDER_REJECTED, ex.getUserMessage(), request));
  }

  @ExceptionHandler(ProviderUnavailableException.class)
  public ResponseEntity<ApiError> handleProviderUnavailable(
      ProviderUnavailableException ex, HttpServletRequest request) {

    String errorId = record("provider_unavailable");
    log.error("Provider unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        error(errorId, ApiError.PROVIDER_UNAVAILABLE, ex.getUserMessage(), request));
  }

  @ExceptionHandler(StoreQueryFailedException.class)
  public ResponseEntity<ApiError> handleStoreQueryFailed(
      StoreQueryFailedException ex, HttpServletRequest request) {

    String errorId = record("store_query_failed");
    log.error("Store query {} failed [{}]: {}", ex.getOperation(), errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        error(errorId, ApiError.STORE_UNAVAILABLE, ex.getUserMessage(), request));
  }

  @ExceptionHandler(BudgetExceededException.class)
  public ResponseEntity<ApiError> handleBudgetExceeded(
      BudgetExceededException ex, HttpServletRequest request) {

    String errorId = record("budget_exceeded");
    log.warn("Budget exceeded [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.TOO_MANY_REQUESTS,
        error(errorId, ApiError.BUDGET_EXCEEDED, "Spending budget exhausted", request));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(
        HttpStatus.BAD_REQUEST, error(errorId, ApiError.VALIDATION_ERROR, message, request));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiError> handleParameterValidation(
      HandlerMethodValidationException ex, HttpServletRequest request) {

    String errorId = record("validation_error");
    String message =
        ex.getAllErrors().stream()
            .findFirst()
            .map(error -> error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(
        HttpStatus.BAD_REQUEST, error(errorId, ApiError.VALIDATION_ERROR, message, request));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParameter(
      MissingServletRequestParameterException ex, HttpServletRequest request) {

    String errorId = record("validation_error");
    String message = ex.getParameterName() + ": is required";
    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(
        HttpStatus.BAD_REQUEST, error(errorId, ApiError.VALIDATION_ERROR, message, request));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

    String errorId = record("validation_error");
    String message = ex.getName() + ": invalid value";
    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(
        HttpStatus.BAD_REQUEST, error(errorId, ApiError.VALIDATION_ERROR, message, request));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        error(
            errorId,
            ApiError.INTERNAL_ERROR,
            "An unexpected error occurred. Please try again later.",
            request));
  }

  private ResponseEntity<ApiError> respond(HttpStatus status, ApiError body) {
    return ResponseEntity.status(status).body(body);
  }

  private ApiError error(
      String errorId, String code, String message, HttpServletRequest request) {
    return errorBuilder(errorId, code, message, request).build();
  }

  private ApiError.ApiErrorBuilder errorBuilder(
      String errorId, String code, String message, HttpServletRequest request) {
    return ApiError.builder()
        .errorId(errorId)
        .code(code)
        .message(message)
        .path(request.getRequestURI())
        .timestamp(Instant.now());
  }

  private String record(String errorType) {
    meterRegistry.counter("errors", "type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
