package com.flamingo.ai.contextengine.exception;

/** Exception thrown when a prompt test definition is invalid. */
public class InvalidPromptTestException extends RuntimeException {

  public InvalidPromptTestException(String message) {
    super(message);
  }
}
