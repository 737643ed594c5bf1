package com.flamingo.ai.contextengine.exception;

/**
 * Exception thrown for non-retryable provider errors (bad request, authentication, unknown model).
 * Retries and the circuit breaker ignore it.
 */
public class ProviderClientException extends RuntimeException {

  private final int statusCode;
  private final String userMessage;

  public ProviderClientException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.userMessage = "AI service rejected the request.";
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
