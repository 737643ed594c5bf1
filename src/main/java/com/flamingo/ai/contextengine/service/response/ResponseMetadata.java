package com.flamingo.ai.contextengine.service.response;

import lombok.Builder;

/**
 * How a reply was produced.
 *
 * @param modelUsed provider model id, or {@code "error"} for the fallback reply
 * @param factChecked always {@code false}; fact checking is not performed
 */
@Builder(toBuilder = true)
public record ResponseMetadata(
    String mood,
    double moodIntensity,
    String modelUsed,
    String modelReasoning,
    double contextQuality,
    int contextTokens,
    int tokensUsed,
    double cost,
    long responseTimeMs,
    String promptTestId,
    String promptVariantId,
    boolean factChecked,
    boolean cached) {}
