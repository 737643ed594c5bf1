package com.flamingo.ai.contextengine.domain.model;

import java.time.Instant;
import lombok.Builder;

/**
 * One provider call's token usage. Append-only.
 *
 * @param cost derived cost in USD; {@code null} means the tracker computes it from the price table
 */
@Builder(toBuilder = true)
public record UsageRecord(
    String model,
    int promptTokens,
    int completionTokens,
    Double cost,
    String operation,
    String userId,
    String channelId,
    Instant timestamp) {

  public int totalTokens() {
    return promptTokens + completionTokens;
  }
}
