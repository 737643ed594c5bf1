package com.flamingo.ai.contextengine.service.search;

import lombok.Builder;

/**
 * Tunables of one hybrid search call. Start from {@link HybridSearchService#defaultOptions} and
 * override with {@code toBuilder()}.
 *
 * @param channelId channel filter, or {@code null} to search every channel
 * @param limit maximum number of results
 * @param semanticWeight weight of the semantic score, keyword weight is the complement
 * @param recentHours messages younger than this get an extra boost
 * @param minScore floor on the combined score, also the vector similarity floor unless adaptive
 * @param temporalDecay decay rate per day of age
 * @param useAdaptiveThreshold derive the semantic floor from the channel's similarity distribution
 */
@Builder(toBuilder = true)
public record SearchOptions(
    String channelId,
    int limit,
    double semanticWeight,
    int recentHours,
    double minScore,
    double temporalDecay,
    boolean useAdaptiveThreshold) {}
