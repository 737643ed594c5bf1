package com.flamingo.ai.contextengine.exception;

import java.time.Duration;

/** Exception thrown when the embedding or completion provider rejects a call for rate limits. */
public class ProviderRateLimitedException extends RuntimeException {

  private final Duration retryAfter;
  private final String userMessage;

  public ProviderRateLimitedException(String message, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.retryAfter = retryAfter;
    this.userMessage = "Service is temporarily busy. Please try again in a moment.";
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
