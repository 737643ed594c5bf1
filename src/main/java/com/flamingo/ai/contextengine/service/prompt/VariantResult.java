package com.flamingo.ai.contextengine.service.prompt;

/** Aggregated metrics of one variant; averages are over the updates that carried the value. */
public record VariantResult(
    String variantId,
    long impressions,
    long engagement,
    double quality,
    double avgResponseTime,
    double avgTokens,
    long errors,
    long conversions) {

  public double engagementRate() {
    return impressions > 0 ? (double) engagement / impressions : 0.0;
  }

  public double errorRate() {
    return impressions > 0 ? (double) errors / impressions : 0.0;
  }

  /** Ranking score: {@code engagementRate * 0.4 + quality * 0.4 - errorRate * 0.2}. */
  public double score() {
    return engagementRate() * 0.4 + quality * 0.4 - errorRate() * 0.2;
  }
}
