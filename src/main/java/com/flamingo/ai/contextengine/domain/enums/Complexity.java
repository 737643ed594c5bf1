package com.flamingo.ai.contextengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Coarse complexity of an inbound message, used for model tiering and prompt selection. */
@Getter
@RequiredArgsConstructor
public enum Complexity {
  SIMPLE(50),
  MODERATE(150),
  COMPLEX(300);

  private final int expectedCompletionTokens;
}
