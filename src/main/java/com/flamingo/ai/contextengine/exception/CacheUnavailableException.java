package com.flamingo.ai.contextengine.exception;

/** Exception thrown when a vector cache tier cannot be read or written. Treated as a miss. */
public class CacheUnavailableException extends RuntimeException {

  private final String tier;

  public CacheUnavailableException(String tier, String message, Throwable cause) {
    super(message, cause);
    this.tier = tier;
  }

  public String getTier() {
    return tier;
  }
}
