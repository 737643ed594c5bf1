package com.flamingo.ai.contextengine.service.prompt;

import lombok.Builder;

/**
 * Outcome signals of one response produced with a prompt variant. Null fields are not recorded.
 *
 * @param quality quality estimate in [0, 1]
 * @param responseTimeMs generation latency in milliseconds
 */
@Builder
public record MetricsUpdate(
    boolean engagement,
    Double quality,
    Long responseTimeMs,
    Integer tokens,
    boolean error,
    boolean conversion) {}
