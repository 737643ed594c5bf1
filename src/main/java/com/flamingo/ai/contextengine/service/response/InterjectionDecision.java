package com.flamingo.ai.contextengine.service.response;

/** Whether to speak up unprompted, and what to say. */
public record InterjectionDecision(boolean interject, String message) {

  public static InterjectionDecision pass() {
    return new InterjectionDecision(false, null);
  }
}
