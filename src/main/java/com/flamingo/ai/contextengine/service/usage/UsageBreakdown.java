package com.flamingo.ai.contextengine.service.usage;

/** Aggregated usage for one model, operation or period. */
public record UsageBreakdown(long requests, long promptTokens, long completionTokens, double cost) {

  public long totalTokens() {
    return promptTokens + completionTokens;
  }
}
