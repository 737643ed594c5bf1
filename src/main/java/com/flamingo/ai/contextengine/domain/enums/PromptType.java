package com.flamingo.ai.contextengine.domain.enums;

/** Kind of prompt a variant test targets. */
public enum PromptType {
  SYSTEM,
  RESPONSE,
  INTERJECTION
}
