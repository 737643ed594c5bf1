package com.flamingo.ai.contextengine.exception;

/** Exception thrown when the provider fails in a retryable way (timeouts, 5xx, open circuit). */
public class ProviderUnavailableException extends RuntimeException {

  private final String userMessage;

  public ProviderUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
