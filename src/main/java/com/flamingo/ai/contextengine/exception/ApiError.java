package com.flamingo.ai.contextengine.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body returned by every REST endpoint of the engine.
 *
 * <p>Codes are grouped by the component that failed: {@code PROMPT_*} for A/B test management,
 * {@code PROVIDER_*} for the completion and embedding provider, {@code STORE_*} for the message
 * store and {@code BUDGET_*} for usage limits.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  public static final String PROMPT_TEST_NOT_FOUND = "PROMPT_001";
  public static final String PROMPT_TEST_INVALID = "PROMPT_002";
  public static final String PROVIDER_UNAVAILABLE = "PROVIDER_001";
  public static final String PROVIDER_RATE_LIMITED = "PROVIDER_002";
  public static final String PROVIDER_REJECTED = "PROVIDER_003";
  public static final String STORE_UNAVAILABLE = "STORE_001";
  public static final String BUDGET_EXCEEDED = "BUDGET_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Id also written to the log line for the failure. */
  private final String errorId;

  private final String code;

  private final String message;

  private final Instant timestamp;

  private final String path;

  /** Seconds the caller should wait before retrying; only set for rate limited calls. */
  private final Long retryAfterSeconds;
}
