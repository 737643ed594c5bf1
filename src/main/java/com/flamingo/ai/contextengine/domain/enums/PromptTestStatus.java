package com.flamingo.ai.contextengine.domain.enums;

/** Lifecycle state of a prompt variant test. */
public enum PromptTestStatus {
  ACTIVE,
  COMPLETED
}
