package com.flamingo.ai.contextengine.exception;

/** Exception thrown when a prompt test is not found. */
public class PromptTestNotFoundException extends RuntimeException {

  private final String testId;

  public PromptTestNotFoundException(String testId) {
    super("Prompt test not found: " + testId);
    this.testId = testId;
  }

  public String getTestId() {
    return testId;
  }
}
