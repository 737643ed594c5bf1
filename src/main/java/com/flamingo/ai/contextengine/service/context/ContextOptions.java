package com.flamingo.ai.contextengine.service.context;

import lombok.Builder;

/**
 * Tunables of one context assembly. Start from {@link ContextAssemblyService#defaultOptions()}.
 *
 * @param threadId thread to include, or {@code null} for the main channel
 * @param useAdaptiveThreshold derive the relevance search floor from the query's similarity
 *     distribution
 */
@Builder(toBuilder = true)
public record ContextOptions(
    int maxTokens,
    int recentLimit,
    int relevantLimit,
    int hoursBack,
    double semanticWeight,
    double diversityWeight,
    String threadId,
    boolean includeThread,
    boolean includeSummaries,
    boolean includeProfiles,
    boolean useAdaptiveThreshold) {

  public boolean wantsThread() {
    return includeThread && threadId != null && !threadId.isBlank();
  }
}
