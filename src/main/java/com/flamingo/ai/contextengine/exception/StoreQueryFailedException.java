package com.flamingo.ai.contextengine.exception;

/** Exception thrown when a query against a backing store fails. */
public class StoreQueryFailedException extends RuntimeException {

  private final String operation;
  private final String userMessage;

  public StoreQueryFailedException(String operation, String message) {
    super(message);
    this.operation = operation;
    this.userMessage = "Message history is temporarily unavailable. Please try again.";
  }

  public StoreQueryFailedException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.userMessage = "Message history is temporarily unavailable. Please try again.";
  }

  public String getOperation() {
    return operation;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
